package com.appraisehub.backend.workflow;

import com.appraisehub.backend.entity.User.UserRole;
import com.appraisehub.backend.exception.ForbiddenException;
import com.appraisehub.backend.security.AppraisalActor;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

import static com.appraisehub.backend.workflow.EvaluationField.*;

/**
 * Which evaluation fields a role may write, depending on its relation to the
 * evaluation. Unrestricted roles (HR, admin, super admin) may write anything.
 */
@Component
public class EvaluationFieldMask {

    private static final Set<EvaluationField> EMPLOYEE_FIELDS =
            Collections.unmodifiableSet(EnumSet.of(SELF_EVALUATION_DATA, SELF_EVALUATION_SUBMITTED_AT));

    private static final Set<EvaluationField> MANAGER_FIELDS = Collections.unmodifiableSet(EnumSet.of(
            MANAGER_EVALUATION_DATA, MANAGER_EVALUATION_SUBMITTED_AT, OVERALL_RATING, FINALIZED_AT, STATUS));

    private final Map<UserRole, Map<ActorRelation, Set<EvaluationField>>> table = new EnumMap<>(UserRole.class);

    public EvaluationFieldMask() {
        grant(UserRole.EMPLOYEE, ActorRelation.OWNER, EMPLOYEE_FIELDS);
        grant(UserRole.MANAGER, ActorRelation.OWNER, EMPLOYEE_FIELDS);
        grant(UserRole.MANAGER, ActorRelation.ASSIGNED_MANAGER, MANAGER_FIELDS);
    }

    private void grant(UserRole role, ActorRelation relation, Set<EvaluationField> fields) {
        table.computeIfAbsent(role, r -> new EnumMap<>(ActorRelation.class)).put(relation, fields);
    }

    public Set<EvaluationField> allowedFields(AppraisalActor actor, Set<ActorRelation> relations) {
        if (actor.isUnrestricted()) {
            return EnumSet.allOf(EvaluationField.class);
        }
        Map<ActorRelation, Set<EvaluationField>> byRelation = table.getOrDefault(actor.getRole(), Map.of());
        Set<EvaluationField> allowed = EnumSet.noneOf(EvaluationField.class);
        for (ActorRelation relation : relations) {
            allowed.addAll(byRelation.getOrDefault(relation, Set.of()));
        }
        return allowed;
    }

    /**
     * Rejects the write if any requested field falls outside the actor's mask.
     *
     * @throws ForbiddenException naming the fields that may not be written
     */
    public void check(AppraisalActor actor, Set<ActorRelation> relations, Set<EvaluationField> requested) {
        Set<EvaluationField> allowed = allowedFields(actor, relations);
        List<String> rejected = requested.stream()
                .filter(field -> !allowed.contains(field))
                .map(EvaluationField::jsonName)
                .sorted()
                .collect(Collectors.toList());

        if (!rejected.isEmpty()) {
            throw new ForbiddenException("Role " + actor.getRole() + " may not modify fields: "
                    + String.join(", ", rejected));
        }
    }
}
