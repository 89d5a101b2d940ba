package com.appraisehub.backend.repository;

import com.appraisehub.backend.entity.*;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AppraisalGroupMemberRepository extends JpaRepository<AppraisalGroupMember, Long> {

    @Query("SELECT m FROM AppraisalGroupMember m JOIN FETCH m.user " +
           "WHERE m.appraisalGroup.id = :groupId ORDER BY m.addedAt ASC, m.id ASC")
    List<AppraisalGroupMember> findMembersWithUsers(@Param("groupId") Long groupId);

    Optional<AppraisalGroupMember> findByAppraisalGroupIdAndUserId(Long groupId, Long userId);

    boolean existsByAppraisalGroupIdAndUserId(Long groupId, Long userId);
}
