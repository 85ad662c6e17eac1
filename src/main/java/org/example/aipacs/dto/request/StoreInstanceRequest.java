package org.example.aipacs.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifying metadata that accompanies one inbound instance transfer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreInstanceRequest {

    public static final String UID_PATTERN = "^[0-9]+(\\.[0-9]+)*$";

    @NotBlank(message = "studyUid is required")
    @Size(max = 64, message = "studyUid longer than 64 characters")
    @Pattern(regexp = UID_PATTERN, message = "studyUid is not a valid UID")
    private String studyUid;

    @NotBlank(message = "seriesUid is required")
    @Size(max = 64, message = "seriesUid longer than 64 characters")
    @Pattern(regexp = UID_PATTERN, message = "seriesUid is not a valid UID")
    private String seriesUid;

    @NotBlank(message = "sopInstanceUid is required")
    @Size(max = 64, message = "sopInstanceUid longer than 64 characters")
    @Pattern(regexp = UID_PATTERN, message = "sopInstanceUid is not a valid UID")
    private String sopInstanceUid;

    @Size(max = 64)
    @Pattern(regexp = UID_PATTERN, message = "sopClassUid is not a valid UID")
    private String sopClassUid;

    @Size(max = 16)
    private String modality;

    @Size(max = 64)
    private String patientId;

    @Size(max = 255)
    private String patientName;
}
