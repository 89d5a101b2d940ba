package com.appraisehub.backend.workflow;

import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.security.AppraisalActor;

import java.util.EnumSet;
import java.util.Set;

/**
 * How an actor stands towards one evaluation. Both may apply when a manager
 * is listed as their own reviewer.
 */
public enum ActorRelation {
    OWNER,
    ASSIGNED_MANAGER;

    public static Set<ActorRelation> of(AppraisalActor actor, Evaluation evaluation) {
        Set<ActorRelation> relations = EnumSet.noneOf(ActorRelation.class);
        if (actor.is(evaluation.getEmployeeId())) {
            relations.add(OWNER);
        }
        if (actor.is(evaluation.getManagerId())) {
            relations.add(ASSIGNED_MANAGER);
        }
        return relations;
    }
}
