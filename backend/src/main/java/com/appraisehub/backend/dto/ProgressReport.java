package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.Evaluation.EvaluationStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProgressReport {

    private Long campaignId;
    private int totalEmployees;
    private int completedEvaluations;
    private int percentage;
    private List<EmployeeProgress> employeeProgress = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmployeeProgress {
        private Long employeeId;
        private String fullName;
        private String email;
        private String code;
        private String department;
        private String designation;
        private Long evaluationId;
        private EvaluationStatus status;
        private Boolean isCompleted;
        private LocalDateTime lastUpdated;
    }
}
