package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "appraisal_groups", indexes = {
        @Index(name = "idx_group_owner", columnList = "created_by_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class AppraisalGroup extends BaseEntity {

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_by_id", nullable = false)
    private Long createdById; // HR manager who owns the group

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GroupStatus status = GroupStatus.ACTIVE;

    @OneToMany(mappedBy = "appraisalGroup", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("addedAt ASC, id ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<AppraisalGroupMember> members = new ArrayList<>();

    public enum GroupStatus {
        ACTIVE, INACTIVE
    }
}
