package org.example.aipacs.dto.response;

import lombok.Builder;
import lombok.Data;

@Data @Builder
public class StoreInstanceResponse {
    private String sopInstanceUid;
    private String status;
    private String reasonCode;
    private String message;
}
