package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;

/**
 * Per-period override of a campaign's timing defaults.
 */
@Entity
@Table(name = "initiated_appraisal_detail_timings",
        uniqueConstraints = @UniqueConstraint(name = "uk_timing_period",
                columnNames = {"initiated_appraisal_id", "frequency_calendar_detail_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class InitiatedAppraisalDetailTiming extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "initiated_appraisal_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private InitiatedAppraisal initiatedAppraisal;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "frequency_calendar_detail_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private FrequencyCalendarDetail frequencyCalendarDetail;

    @Column(name = "days_to_initiate", nullable = false)
    private Integer daysToInitiate = 0;

    @Column(name = "days_to_close", nullable = false)
    private Integer daysToClose = 30;

    @Column(name = "number_of_reminders", nullable = false)
    private Integer numberOfReminders = 3;
}
