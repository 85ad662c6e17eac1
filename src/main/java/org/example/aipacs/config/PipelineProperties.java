package org.example.aipacs.config;

import lombok.Getter;
import lombok.Setter;
import org.example.aipacs.model.ReportFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineProperties {

    /** Root directory for received instances and generated reports. */
    private String storageRoot = "./data";

    /** Largest accepted instance payload. */
    private long maxPayloadBytes = 512L * 1024 * 1024;

    private final Assembly assembly = new Assembly();
    private final Workers workers = new Workers();
    private final Retry retry = new Retry();
    private final Report report = new Report();

    @Getter
    @Setter
    public static class Assembly {
        /** Quiet period after the last instance before a study is considered complete. */
        private Duration idleTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Workers {
        private int count = 4;
        private int queueCapacity = 100;
        /** How long a worker owns an in-flight job before it may be reclaimed. */
        private Duration lease = Duration.ofMinutes(10);
        private Duration dispatchInterval = Duration.ofSeconds(5);
        private int dispatchBatch = 50;
    }

    @Getter
    @Setter
    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(60);
        private int maxAttempts = 5;
    }

    @Getter
    @Setter
    public static class Report {
        private ReportFormat format = ReportFormat.JSON;
        private String templateVersion = "1";
    }
}
