package com.appraisehub.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MeetingNotesRequest {

    @NotBlank
    private String meetingNotes;

    private Integer finalRating; // optional revision of the overall rating

    private Boolean showNotesToEmployee;
}
