package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.AppraisalGroupMember;
import com.appraisehub.backend.entity.User;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class GroupMemberDTO {

    private Long memberId;
    private Long userId;
    private String fullName;
    private String email;
    private String code;
    private String department;
    private String designation;
    private Boolean isActive;
    private Long addedById;
    private LocalDateTime addedAt;

    public static GroupMemberDTO from(AppraisalGroupMember member) {
        User user = member.getUser();
        GroupMemberDTO dto = new GroupMemberDTO();
        dto.setMemberId(member.getId());
        dto.setUserId(user.getId());
        dto.setFullName(user.getFullName());
        dto.setEmail(user.getEmail());
        dto.setCode(user.getCode());
        dto.setDepartment(user.getDepartment());
        dto.setDesignation(user.getDesignation());
        dto.setIsActive(user.getIsActive());
        dto.setAddedById(member.getAddedById());
        dto.setAddedAt(member.getAddedAt());
        return dto;
    }
}
