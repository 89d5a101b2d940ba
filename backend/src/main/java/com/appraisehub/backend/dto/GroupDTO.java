package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.AppraisalGroup;
import com.appraisehub.backend.entity.AppraisalGroup.GroupStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class GroupDTO {

    private Long id;
    private String name;
    private String description;
    private GroupStatus status;
    private Long createdById;
    private LocalDateTime createdAt;

    public static GroupDTO from(AppraisalGroup group) {
        GroupDTO dto = new GroupDTO();
        dto.setId(group.getId());
        dto.setName(group.getName());
        dto.setDescription(group.getDescription());
        dto.setStatus(group.getStatus());
        dto.setCreatedById(group.getCreatedById());
        dto.setCreatedAt(group.getCreatedAt());
        return dto;
    }
}
