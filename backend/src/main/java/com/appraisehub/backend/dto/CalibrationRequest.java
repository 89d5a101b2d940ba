package com.appraisehub.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationRequest {

    @NotNull
    private Integer calibratedRating;

    private String calibrationRemarks;
}
