package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "appraisal_group_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_group_member", columnNames = {"appraisal_group_id", "user_id"}),
        indexes = @Index(name = "idx_member_user", columnList = "user_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class AppraisalGroupMember extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appraisal_group_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AppraisalGroup appraisalGroup;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "added_by_id", nullable = false)
    private Long addedById;

    @Column(name = "added_at", nullable = false)
    private LocalDateTime addedAt;
}
