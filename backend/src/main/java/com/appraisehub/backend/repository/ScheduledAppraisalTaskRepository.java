package com.appraisehub.backend.repository;

import com.appraisehub.backend.entity.*;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ScheduledAppraisalTaskRepository extends JpaRepository<ScheduledAppraisalTask, Long> {

    List<ScheduledAppraisalTask> findByInitiatedAppraisalIdOrderByScheduledDateAscIdAsc(Long initiatedAppraisalId);

    boolean existsByInitiatedAppraisalIdAndPeriodKeyAndTaskTypeAndSequenceNo(
            Long initiatedAppraisalId, String periodKey,
            ScheduledAppraisalTask.TaskType taskType, Integer sequenceNo);

    @Query("SELECT t FROM ScheduledAppraisalTask t WHERE t.status = :status AND t.scheduledDate <= :today " +
           "ORDER BY t.scheduledDate ASC, t.id ASC")
    List<ScheduledAppraisalTask> findDue(@Param("status") ScheduledAppraisalTask.TaskStatus status,
                                         @Param("today") LocalDate today);
}
