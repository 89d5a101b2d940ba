package com.appraisehub.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one generation run. Per-employee failures do not abort the run;
 * they are listed in {@code failures}.
 */
@Data
@NoArgsConstructor
public class GenerationResult {

    private int created;
    private int skipped;
    private int totalEligible;
    private List<GenerationFailure> failures = new ArrayList<>();

    public boolean isPartialFailure() {
        return !failures.isEmpty();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerationFailure {
        private Long employeeId;
        private String reason;
    }
}
