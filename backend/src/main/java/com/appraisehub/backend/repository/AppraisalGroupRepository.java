package com.appraisehub.backend.repository;

import com.appraisehub.backend.entity.*;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AppraisalGroupRepository extends JpaRepository<AppraisalGroup, Long> {
    List<AppraisalGroup> findByCreatedByIdOrderByCreatedAtDesc(Long createdById);
}
