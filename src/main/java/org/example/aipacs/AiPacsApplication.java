package org.example.aipacs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiPacsApplication {
    public static void main(String[] args) {
        SpringApplication.run(AiPacsApplication.class, args);
    }
}
