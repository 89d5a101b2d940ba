package com.appraisehub.backend.repository;

import com.appraisehub.backend.entity.*;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InitiatedAppraisalRepository extends JpaRepository<InitiatedAppraisal, Long> {
    List<InitiatedAppraisal> findByCreatedByIdOrderByCreatedAtDesc(Long createdById);

    List<InitiatedAppraisal> findAllByOrderByCreatedAtDesc();

    boolean existsByAppraisalGroupId(Long appraisalGroupId);
}
