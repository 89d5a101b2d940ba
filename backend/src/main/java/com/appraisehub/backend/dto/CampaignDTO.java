package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.InitiatedAppraisal;
import com.appraisehub.backend.entity.InitiatedAppraisal.AppraisalType;
import com.appraisehub.backend.entity.InitiatedAppraisal.CampaignStatus;
import com.appraisehub.backend.entity.InitiatedAppraisal.PublishType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@NoArgsConstructor
public class CampaignDTO {

    private Long id;
    private Long appraisalGroupId;
    private String appraisalGroupName;
    private AppraisalType appraisalType;
    private List<Long> questionnaireTemplateIds = new ArrayList<>();
    private String documentUrl;
    private Long frequencyCalendarId;
    private Integer daysToInitiate;
    private Integer daysToClose;
    private Integer numberOfReminders;
    private Boolean excludeTenureLessThanYear;
    private Set<Long> excludedEmployeeIds = new LinkedHashSet<>();
    private Boolean makePublic;
    private PublishType publishType;
    private CampaignStatus status;
    private Long createdById;
    private LocalDateTime createdAt;

    // Filled only when listing with progress
    private ProgressReport progress;

    public static CampaignDTO from(InitiatedAppraisal campaign) {
        CampaignDTO dto = new CampaignDTO();
        dto.setId(campaign.getId());
        if (campaign.getAppraisalGroup() != null) {
            dto.setAppraisalGroupId(campaign.getAppraisalGroup().getId());
            dto.setAppraisalGroupName(campaign.getAppraisalGroup().getName());
        }
        dto.setAppraisalType(campaign.getAppraisalType());
        dto.setQuestionnaireTemplateIds(new ArrayList<>(campaign.getQuestionnaireTemplateIds()));
        dto.setDocumentUrl(campaign.getDocumentUrl());
        if (campaign.getFrequencyCalendar() != null) {
            dto.setFrequencyCalendarId(campaign.getFrequencyCalendar().getId());
        }
        dto.setDaysToInitiate(campaign.getDaysToInitiate());
        dto.setDaysToClose(campaign.getDaysToClose());
        dto.setNumberOfReminders(campaign.getNumberOfReminders());
        dto.setExcludeTenureLessThanYear(campaign.getExcludeTenureLessThanYear());
        dto.setExcludedEmployeeIds(new LinkedHashSet<>(campaign.getExcludedEmployeeIds()));
        dto.setMakePublic(campaign.getMakePublic());
        dto.setPublishType(campaign.getPublishType());
        dto.setStatus(campaign.getStatus());
        dto.setCreatedById(campaign.getCreatedById());
        dto.setCreatedAt(campaign.getCreatedAt());
        return dto;
    }
}
