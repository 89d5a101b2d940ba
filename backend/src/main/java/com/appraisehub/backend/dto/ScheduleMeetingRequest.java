package com.appraisehub.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleMeetingRequest {

    @NotNull
    private LocalDateTime meetingScheduledAt;

    private String title;
    private String description;

    @Min(15)
    private Integer durationMinutes;

    private String location;
}
