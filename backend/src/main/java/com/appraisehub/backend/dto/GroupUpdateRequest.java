package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.AppraisalGroup.GroupStatus;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update: only the fields that are present change.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GroupUpdateRequest {

    @Size(max = 200)
    private String name;

    private String description;

    private GroupStatus status;
}
