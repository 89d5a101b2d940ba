package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;
import java.time.LocalDate;

@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_email", columnList = "email"),
        @Index(name = "idx_reporting_manager", columnList = "reporting_manager_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class User extends BaseEntity {

    @Column(nullable = false, unique = true, length = 100)
    private String email;

    @Column(nullable = false, length = 100)
    private String fullName;

    @Column(unique = true, length = 50)
    private String code; // employee code, e.g. "EMP-0042"

    @Column(length = 100)
    private String designation;

    @Column(length = 100)
    private String department;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Column(name = "date_of_joining")
    private LocalDate dateOfJoining;

    @Column(name = "reporting_manager_id")
    private Long reportingManagerId;

    @Column(name = "is_active")
    private Boolean isActive = true;

    public boolean isActiveUser() {
        return Boolean.TRUE.equals(isActive);
    }

    public enum UserRole {
        SUPER_ADMIN, ADMIN, HR_MANAGER, MANAGER, EMPLOYEE;

        /**
         * Roles that act on evaluations without ownership restrictions.
         */
        public boolean isUnrestricted() {
            return this == SUPER_ADMIN || this == ADMIN || this == HR_MANAGER;
        }
    }
}
