package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.ResponseSet;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManagerReviewRequest {

    @NotNull
    private ResponseSet managerEvaluationData;

    @NotNull
    private Integer overallRating;
}
