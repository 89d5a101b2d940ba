package com.appraisehub.backend.workflow;

import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.entity.User.UserRole;
import com.appraisehub.backend.exception.ForbiddenException;
import com.appraisehub.backend.exception.ValidationException;
import com.appraisehub.backend.security.AppraisalActor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Transition table for the evaluation lifecycle
 * {@code NOT_STARTED -> DRAFT -> SELF_SUBMITTED -> REVIEWED -> COMPLETED}.
 * <p>
 * Role checks run before state checks, so an actor without access learns
 * nothing about the evaluation's state.
 */
@Component
public class TransitionGuard {

    private final Map<EvaluationAction, TransitionRule> rules = new EnumMap<>(EvaluationAction.class);

    public TransitionGuard() {
        TransitionRule selfEdit = ownerOnly()
                .require(e -> !e.isFinalized(), "evaluation already finalized")
                .require(e -> !e.isSelfSubmitted(), "self evaluation already submitted");
        rules.put(EvaluationAction.SAVE_SELF_DRAFT, selfEdit);
        rules.put(EvaluationAction.SUBMIT_SELF_EVALUATION, selfEdit);

        rules.put(EvaluationAction.SUBMIT_MANAGER_REVIEW, new TransitionRule()
                .allow(UserRole.MANAGER, ActorRelation.ASSIGNED_MANAGER)
                .allowUnrestricted()
                .require(e -> !e.isFinalized(), "evaluation already finalized")
                .require(Evaluation::isSelfSubmitted, "self evaluation not submitted"));

        rules.put(EvaluationAction.SCHEDULE_MEETING, new TransitionRule()
                .allow(UserRole.EMPLOYEE, ActorRelation.OWNER)
                .allow(UserRole.MANAGER, ActorRelation.OWNER, ActorRelation.ASSIGNED_MANAGER)
                .allowUnrestricted()
                .require(e -> !e.isFinalized(), "evaluation already finalized")
                .require(Evaluation::isManagerSubmitted, "manager evaluation not submitted"));

        rules.put(EvaluationAction.RECORD_MEETING_NOTES, new TransitionRule()
                .allow(UserRole.MANAGER, ActorRelation.ASSIGNED_MANAGER)
                .allowUnrestricted()
                .require(e -> !e.isFinalized(), "evaluation already finalized")
                .require(e -> e.getMeetingScheduledAt() != null, "meeting not scheduled"));

        rules.put(EvaluationAction.FINALIZE, new TransitionRule()
                .allow(UserRole.MANAGER, ActorRelation.ASSIGNED_MANAGER)
                .allowUnrestricted()
                .require(e -> !e.isFinalized(), "evaluation already finalized")
                .require(Evaluation::isSelfSubmitted, "self evaluation not submitted")
                .require(Evaluation::isManagerSubmitted, "manager evaluation not submitted"));

        rules.put(EvaluationAction.CALIBRATE, new TransitionRule()
                .allowUnrestricted()
                .require(e -> e.getStatus() == Evaluation.EvaluationStatus.COMPLETED,
                        "evaluation must be completed before calibration"));
    }

    private static TransitionRule ownerOnly() {
        TransitionRule rule = new TransitionRule();
        for (UserRole role : UserRole.values()) {
            rule.allow(role, ActorRelation.OWNER);
        }
        return rule;
    }

    /**
     * @throws ForbiddenException  if the actor's role or relation does not allow the action
     * @throws ValidationException if the evaluation is not in a state that allows it
     */
    public void check(EvaluationAction action, AppraisalActor actor, Set<ActorRelation> relations,
                      Evaluation evaluation) {
        TransitionRule rule = rules.get(action);
        if (rule == null || !rule.grants(actor.getRole())) {
            throw new ForbiddenException("Role " + actor.getRole() + " may not perform " + action);
        }

        Set<ActorRelation> required = rule.requiredRelations(actor.getRole());
        if (!required.isEmpty() && Collections.disjoint(required, relations)) {
            throw new ForbiddenException("Not permitted to perform " + action + " on evaluation "
                    + evaluation.getId());
        }

        for (TransitionRule.Precondition precondition : rule.getPreconditions()) {
            if (!precondition.getTest().test(evaluation)) {
                throw new ValidationException(precondition.getMessage());
            }
        }
    }
}
