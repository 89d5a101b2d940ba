package com.appraisehub.backend.service;

import com.appraisehub.backend.entity.AppraisalGroupMember;
import com.appraisehub.backend.entity.InitiatedAppraisal;
import com.appraisehub.backend.entity.User;
import com.appraisehub.backend.exception.NotFoundException;
import com.appraisehub.backend.repository.AppraisalGroupMemberRepository;
import com.appraisehub.backend.repository.AppraisalGroupRepository;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Works out which members of an appraisal group take part in a campaign.
 * Inactive users are ignored entirely; active users removed by an exclusion
 * rule are reported separately.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MembershipResolver {

    private final AppraisalGroupRepository groupRepository;
    private final AppraisalGroupMemberRepository memberRepository;
    private final Clock clock;

    @Value("${appraisal.tenure-months:12}")
    private int tenureMonths = 12;

    @Transactional(readOnly = true)
    public MembershipResolution resolve(InitiatedAppraisal campaign) {
        return resolve(campaign.getAppraisalGroup().getId(),
                campaign.getExcludedEmployeeIds(),
                Boolean.TRUE.equals(campaign.getExcludeTenureLessThanYear()));
    }

    @Transactional(readOnly = true)
    public MembershipResolution resolve(Long groupId, Collection<Long> excludedEmployeeIds, boolean excludeShortTenure) {
        if (!groupRepository.existsById(groupId)) {
            throw NotFoundException.of("Appraisal group", groupId);
        }

        Set<Long> excludedIds = excludedEmployeeIds == null ? Set.of() : new HashSet<>(excludedEmployeeIds);
        LocalDate tenureCutoff = LocalDate.now(clock).minusMonths(tenureMonths);

        MembershipResolution resolution = new MembershipResolution();
        Set<Long> seen = new HashSet<>();

        for (AppraisalGroupMember member : memberRepository.findMembersWithUsers(groupId)) {
            User user = member.getUser();
            if (!user.isActiveUser() || !seen.add(user.getId())) {
                continue;
            }
            if (excludedIds.contains(user.getId())) {
                resolution.getExcluded().add(user);
            } else if (excludeShortTenure && joinedAfter(user, tenureCutoff)) {
                resolution.getExcluded().add(user);
            } else {
                resolution.getEligible().add(user);
            }
        }

        log.debug("Group {}: {} eligible, {} excluded", groupId,
                resolution.getEligible().size(), resolution.getExcluded().size());
        return resolution;
    }

    // No join date on record counts as long-tenured
    private static boolean joinedAfter(User user, LocalDate cutoff) {
        return user.getDateOfJoining() != null && user.getDateOfJoining().isAfter(cutoff);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MembershipResolution {
        private List<User> eligible = new ArrayList<>();
        private List<User> excluded = new ArrayList<>();
    }
}
