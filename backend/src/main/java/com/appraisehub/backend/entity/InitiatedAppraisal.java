package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One review campaign run against an appraisal group.
 */
@Entity
@Table(name = "initiated_appraisals", indexes = {
        @Index(name = "idx_appraisal_owner", columnList = "created_by_id"),
        @Index(name = "idx_appraisal_group", columnList = "appraisal_group_id"),
        @Index(name = "idx_appraisal_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class InitiatedAppraisal extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appraisal_group_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AppraisalGroup appraisalGroup;

    @Enumerated(EnumType.STRING)
    @Column(name = "appraisal_type", nullable = false, length = 30)
    private AppraisalType appraisalType;

    @ElementCollection
    @CollectionTable(name = "initiated_appraisal_templates",
            joinColumns = @JoinColumn(name = "initiated_appraisal_id"))
    @Column(name = "questionnaire_template_id")
    private List<Long> questionnaireTemplateIds = new ArrayList<>();

    @Column(name = "document_url", length = 500)
    private String documentUrl; // KPI / MBO sheet

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "frequency_calendar_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private FrequencyCalendar frequencyCalendar;

    @Column(name = "days_to_initiate", nullable = false)
    private Integer daysToInitiate = 0;

    @Column(name = "days_to_close", nullable = false)
    private Integer daysToClose = 30;

    @Column(name = "number_of_reminders", nullable = false)
    private Integer numberOfReminders = 3;

    @Column(name = "exclude_tenure_less_than_year", nullable = false)
    private Boolean excludeTenureLessThanYear = false;

    @ElementCollection
    @CollectionTable(name = "initiated_appraisal_exclusions",
            joinColumns = @JoinColumn(name = "initiated_appraisal_id"))
    @Column(name = "employee_id")
    private Set<Long> excludedEmployeeIds = new LinkedHashSet<>();

    @Column(name = "make_public", nullable = false)
    private Boolean makePublic = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "publish_type", nullable = false, length = 20)
    private PublishType publishType = PublishType.NOW;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CampaignStatus status = CampaignStatus.DRAFT;

    @Column(name = "created_by_id", nullable = false)
    private Long createdById; // HR manager who initiated the campaign

    @OneToMany(mappedBy = "initiatedAppraisal", cascade = CascadeType.ALL, orphanRemoval = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<InitiatedAppraisalDetailTiming> detailTimings = new ArrayList<>();

    public void addDetailTiming(InitiatedAppraisalDetailTiming timing) {
        timing.setInitiatedAppraisal(this);
        detailTimings.add(timing);
    }

    public enum AppraisalType {
        QUESTIONNAIRE_BASED, KPI_BASED, MBO_BASED, OKR_BASED
    }

    public enum PublishType {
        NOW, AS_PER_CALENDAR
    }

    public enum CampaignStatus {
        DRAFT, ACTIVE, CLOSED, CANCELLED
    }
}
