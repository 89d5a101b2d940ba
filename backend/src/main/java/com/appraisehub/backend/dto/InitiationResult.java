package com.appraisehub.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InitiationResult {

    private CampaignDTO campaign;
    private GenerationResult generation; // null unless published now
    private List<ScheduledTaskDTO> scheduledTasks = new ArrayList<>();
}
