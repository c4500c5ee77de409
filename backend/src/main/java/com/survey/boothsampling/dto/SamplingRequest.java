package com.survey.boothsampling.dto;

import com.survey.boothsampling.model.SelectionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Batch parameters, applied uniformly to every region of the run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SamplingRequest {

    @NotBlank(message = "State cannot be empty")
    private String state;

    @NotNull(message = "Selection type cannot be null")
    private SelectionType selectionType;

    @NotNull(message = "Samples per region cannot be null")
    @Min(value = 25, message = "At least 25 samples per region are required")
    @Max(value = 5000, message = "At most 5000 samples per region are allowed")
    private Integer samplesPerRegion;

    private String requestedBy;
}
