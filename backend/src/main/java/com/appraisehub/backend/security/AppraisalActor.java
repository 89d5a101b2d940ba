package com.appraisehub.backend.security;

import com.appraisehub.backend.entity.User;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Authenticated caller, resolved from the bearer token.
 */
@Getter
@AllArgsConstructor
@ToString
public class AppraisalActor {

    private final Long id;
    private final User.UserRole role;

    public boolean isUnrestricted() {
        return role != null && role.isUnrestricted();
    }

    public boolean is(Long userId) {
        return id != null && id.equals(userId);
    }
}
