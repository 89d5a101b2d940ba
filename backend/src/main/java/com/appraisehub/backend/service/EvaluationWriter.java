package com.appraisehub.backend.service;

import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.repository.EvaluationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts evaluations one per transaction, so a bad row never rolls back the
 * rows written before it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EvaluationWriter {

    private final EvaluationRepository evaluationRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public StorageResult<Evaluation> insertIfAbsent(Evaluation evaluation) {
        if (evaluationRepository.existsByEmployeeIdAndInitiatedAppraisalId(
                evaluation.getEmployeeId(), evaluation.getInitiatedAppraisalId())) {
            return StorageResult.conflict("evaluation already exists");
        }
        // Flush so a unique-key race surfaces here, not at commit
        Evaluation saved = evaluationRepository.saveAndFlush(evaluation);
        log.debug("Created evaluation {} for employee {}", saved.getId(), saved.getEmployeeId());
        return StorageResult.success(saved);
    }
}
