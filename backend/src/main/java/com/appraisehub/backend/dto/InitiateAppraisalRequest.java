package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.InitiatedAppraisal.AppraisalType;
import com.appraisehub.backend.entity.InitiatedAppraisal.PublishType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InitiateAppraisalRequest {

    @NotNull
    private Long appraisalGroupId;

    @NotNull
    private AppraisalType appraisalType;

    private List<Long> questionnaireTemplateIds = new ArrayList<>();
    private String documentUrl;

    private Long frequencyCalendarId;

    @Min(0)
    private Integer daysToInitiate;

    @Min(0)
    private Integer daysToClose;

    @Min(0)
    @Max(10)
    private Integer numberOfReminders;

    private Boolean excludeTenureLessThanYear = false;
    private Set<Long> excludedEmployeeIds = new LinkedHashSet<>();

    private Boolean makePublic = false;
    private PublishType publishType = PublishType.NOW;

    @Valid
    private List<CalendarDetailTiming> detailTimings = new ArrayList<>();

    /**
     * Timing override for one calendar period. Missing values fall back to the
     * campaign level ones.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CalendarDetailTiming {
        @NotNull
        private Long frequencyCalendarDetailId;

        @Min(0)
        private Integer daysToInitiate;

        @Min(0)
        private Integer daysToClose;

        @Min(0)
        @Max(10)
        private Integer numberOfReminders;
    }
}
