package com.appraisehub.backend.workflow;

import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.entity.User.UserRole;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.*;
import java.util.function.Predicate;

/**
 * Who may perform an action and what the evaluation must look like first.
 * A role mapped to an empty relation set needs no relation to the evaluation.
 */
public class TransitionRule {

    private final Map<UserRole, Set<ActorRelation>> grants = new EnumMap<>(UserRole.class);
    private final List<Precondition> preconditions = new ArrayList<>();

    public TransitionRule allow(UserRole role, ActorRelation... relations) {
        Set<ActorRelation> required = EnumSet.noneOf(ActorRelation.class);
        required.addAll(Arrays.asList(relations));
        grants.put(role, required);
        return this;
    }

    public TransitionRule allowUnrestricted() {
        for (UserRole role : UserRole.values()) {
            if (role.isUnrestricted()) {
                allow(role);
            }
        }
        return this;
    }

    public TransitionRule require(Predicate<Evaluation> test, String message) {
        preconditions.add(new Precondition(test, message));
        return this;
    }

    public boolean grants(UserRole role) {
        return grants.containsKey(role);
    }

    public Set<ActorRelation> requiredRelations(UserRole role) {
        return grants.getOrDefault(role, Set.of());
    }

    public List<Precondition> getPreconditions() {
        return Collections.unmodifiableList(preconditions);
    }

    @Getter
    @AllArgsConstructor
    public static class Precondition {
        private final Predicate<Evaluation> test;
        private final String message;
    }
}
