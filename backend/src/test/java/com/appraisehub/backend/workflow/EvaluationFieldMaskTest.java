package com.appraisehub.backend.workflow;

import com.appraisehub.backend.entity.User.UserRole;
import com.appraisehub.backend.exception.ForbiddenException;
import com.appraisehub.backend.security.AppraisalActor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

class EvaluationFieldMaskTest {

    private final EvaluationFieldMask mask = new EvaluationFieldMask();

    private static final AppraisalActor EMPLOYEE = new AppraisalActor(10L, UserRole.EMPLOYEE);
    private static final AppraisalActor MANAGER = new AppraisalActor(20L, UserRole.MANAGER);
    private static final AppraisalActor HR = new AppraisalActor(30L, UserRole.HR_MANAGER);

    @Nested
    @DisplayName("Employee")
    class EmployeeMask {

        @Test
        @DisplayName("owner may write only the self evaluation fields")
        void ownerMask() {
            Set<EvaluationField> allowed = mask.allowedFields(EMPLOYEE, EnumSet.of(ActorRelation.OWNER));

            assertThat(allowed).containsExactlyInAnyOrder(
                    EvaluationField.SELF_EVALUATION_DATA, EvaluationField.SELF_EVALUATION_SUBMITTED_AT);
        }

        @Test
        @DisplayName("writing the overall rating is rejected and the field is named")
        void rejectsManagerField() {
            assertThatThrownBy(() -> mask.check(EMPLOYEE, EnumSet.of(ActorRelation.OWNER),
                    EnumSet.of(EvaluationField.SELF_EVALUATION_DATA, EvaluationField.OVERALL_RATING)))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessageContaining("overallRating")
                    .hasMessageNotContaining("selfEvaluationData");
        }

        @Test
        @DisplayName("someone else's evaluation allows no fields at all")
        void noRelationNoFields() {
            assertThat(mask.allowedFields(EMPLOYEE, EnumSet.noneOf(ActorRelation.class))).isEmpty();

            assertThatThrownBy(() -> mask.check(EMPLOYEE, EnumSet.noneOf(ActorRelation.class),
                    EnumSet.of(EvaluationField.SELF_EVALUATION_DATA)))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("Manager")
    class ManagerMask {

        @Test
        @DisplayName("assigned manager may finalize but not touch the self evaluation")
        void assignedManager() {
            Set<EvaluationField> allowed = mask.allowedFields(MANAGER, EnumSet.of(ActorRelation.ASSIGNED_MANAGER));

            assertThat(allowed).contains(EvaluationField.MANAGER_EVALUATION_DATA, EvaluationField.OVERALL_RATING,
                    EvaluationField.FINALIZED_AT, EvaluationField.STATUS);
            assertThat(allowed).doesNotContain(EvaluationField.SELF_EVALUATION_DATA, EvaluationField.CALIBRATED_RATING);
        }

        @Test
        @DisplayName("owner and assigned manager at once gets the union")
        void unionOfRelations() {
            Set<EvaluationField> allowed = mask.allowedFields(MANAGER,
                    EnumSet.of(ActorRelation.OWNER, ActorRelation.ASSIGNED_MANAGER));

            assertThat(allowed).contains(EvaluationField.SELF_EVALUATION_DATA, EvaluationField.MANAGER_EVALUATION_DATA);
        }
    }

    @Test
    @DisplayName("HR writes any field without a relation")
    void hrUnrestricted() {
        assertThatCode(() -> mask.check(HR, EnumSet.noneOf(ActorRelation.class),
                EnumSet.allOf(EvaluationField.class)))
                .doesNotThrowAnyException();
    }
}
