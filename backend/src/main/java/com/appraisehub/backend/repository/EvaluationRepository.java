package com.appraisehub.backend.repository;

import com.appraisehub.backend.entity.*;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface EvaluationRepository extends JpaRepository<Evaluation, Long> {

    Optional<Evaluation> findByEmployeeIdAndInitiatedAppraisalId(Long employeeId, Long initiatedAppraisalId);

    boolean existsByEmployeeIdAndInitiatedAppraisalId(Long employeeId, Long initiatedAppraisalId);

    boolean existsByInitiatedAppraisalId(Long initiatedAppraisalId);

    List<Evaluation> findByInitiatedAppraisalId(Long initiatedAppraisalId);

    List<Evaluation> findByInitiatedAppraisalIdAndEmployeeIdIn(Long initiatedAppraisalId, Collection<Long> employeeIds);

    @Query("SELECT e FROM Evaluation e WHERE e.employeeId = :userId OR e.managerId = :userId ORDER BY e.createdAt DESC")
    List<Evaluation> findVisibleTo(@Param("userId") Long userId);

    List<Evaluation> findByManagerIdAndSelfEvaluationSubmittedAtIsNotNullAndManagerEvaluationSubmittedAtIsNull(Long managerId);
}
