package org.example.aipacs.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A finding as the engine reports it, before normalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawFinding {
    @JsonAlias({"type", "finding_type", "label"})
    private String category;
    private Double confidence;
    private Integer x;
    private Integer y;
    private Integer z;
    private Integer width;
    private Integer height;
    private Integer depth;
    private String severity;
    private String description;
    private Map<String, Double> measurements;
}
