package com.appraisehub.backend.service;

import com.appraisehub.backend.dto.GroupDTO;
import com.appraisehub.backend.dto.GroupMemberDTO;
import com.appraisehub.backend.dto.GroupRequest;
import com.appraisehub.backend.dto.GroupUpdateRequest;
import com.appraisehub.backend.entity.AppraisalGroup;
import com.appraisehub.backend.entity.AppraisalGroupMember;
import com.appraisehub.backend.entity.User;
import com.appraisehub.backend.exception.ConflictException;
import com.appraisehub.backend.exception.ForbiddenException;
import com.appraisehub.backend.exception.NotFoundException;
import com.appraisehub.backend.exception.ValidationException;
import com.appraisehub.backend.repository.AppraisalGroupMemberRepository;
import com.appraisehub.backend.repository.AppraisalGroupRepository;
import com.appraisehub.backend.repository.InitiatedAppraisalRepository;
import com.appraisehub.backend.repository.UserRepository;
import com.appraisehub.backend.security.AppraisalActor;
import com.appraisehub.backend.util.CacheKeyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Appraisal groups and their membership. An HR manager works on the groups
 * they created; admins on any group.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AppraisalGroupService {

    private final AppraisalGroupRepository groupRepository;
    private final AppraisalGroupMemberRepository memberRepository;
    private final UserRepository userRepository;
    private final InitiatedAppraisalRepository campaignRepository;
    private final CacheService cacheService;
    private final Clock clock;

    @Transactional
    public GroupDTO createGroup(GroupRequest request, AppraisalActor actor) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Group name is required");
        }

        AppraisalGroup group = new AppraisalGroup();
        group.setName(request.getName().trim());
        group.setDescription(request.getDescription());
        group.setCreatedById(actor.getId());
        group.setStatus(AppraisalGroup.GroupStatus.ACTIVE);
        group = groupRepository.save(group);

        log.info("Created appraisal group {} '{}' for user {}", group.getId(), group.getName(), actor.getId());
        return GroupDTO.from(group);
    }

    @Transactional(readOnly = true)
    public List<GroupDTO> listGroups(AppraisalActor actor) {
        List<AppraisalGroup> groups = actor.getRole() == User.UserRole.HR_MANAGER
                ? groupRepository.findByCreatedByIdOrderByCreatedAtDesc(actor.getId())
                : groupRepository.findAll();
        return groups.stream().map(GroupDTO::from).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public GroupDTO getGroup(Long groupId, AppraisalActor actor) {
        return GroupDTO.from(loadOwned(groupId, actor));
    }

    /**
     * Renames, re-describes or (de)activates a group. An inactive group keeps
     * its members and campaigns but cannot start new campaigns.
     */
    @Transactional
    public GroupDTO updateGroup(Long groupId, GroupUpdateRequest request, AppraisalActor actor) {
        AppraisalGroup group = loadOwned(groupId, actor);

        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new ValidationException("Group name must not be blank");
            }
            group.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            group.setDescription(request.getDescription());
        }
        if (request.getStatus() != null && request.getStatus() != group.getStatus()) {
            log.info("Appraisal group {} is now {}", groupId, request.getStatus());
            group.setStatus(request.getStatus());
        }

        return GroupDTO.from(groupRepository.save(group));
    }

    /**
     * Deletes a group and its memberships. Refused while any campaign still
     * points at the group.
     */
    @Transactional
    public void deleteGroup(Long groupId, AppraisalActor actor) {
        AppraisalGroup group = loadOwned(groupId, actor);
        if (campaignRepository.existsByAppraisalGroupId(groupId)) {
            throw new ConflictException("Appraisal group " + groupId + " is used by an initiated appraisal");
        }

        groupRepository.delete(group);
        log.info("Deleted appraisal group {} by user {}", groupId, actor.getId());
    }

    @Transactional
    public GroupMemberDTO addMember(Long groupId, Long userId, AppraisalActor actor) {
        AppraisalGroup group = loadOwned(groupId, actor);

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ValidationException("User not found: " + userId));
        if (!user.isActiveUser()) {
            throw new ValidationException("User " + userId + " is inactive");
        }
        if (memberRepository.existsByAppraisalGroupIdAndUserId(groupId, userId)) {
            throw new ConflictException("User " + userId + " is already a member of group " + groupId);
        }

        AppraisalGroupMember member = new AppraisalGroupMember();
        member.setAppraisalGroup(group);
        member.setUser(user);
        member.setAddedById(actor.getId());
        member.setAddedAt(LocalDateTime.now(clock));

        try {
            member = memberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("User " + userId + " is already a member of group " + groupId, e);
        }

        cacheService.invalidatePattern(CacheKeyBuilder.progressPattern());
        log.info("Added user {} to appraisal group {}", userId, groupId);
        return GroupMemberDTO.from(member);
    }

    /**
     * Removes a member. Evaluations already generated for them are kept.
     */
    @Transactional
    public void removeMember(Long groupId, Long userId, AppraisalActor actor) {
        loadOwned(groupId, actor);

        AppraisalGroupMember member = memberRepository.findByAppraisalGroupIdAndUserId(groupId, userId)
                .orElseThrow(() -> new NotFoundException("User " + userId + " is not a member of group " + groupId));
        memberRepository.delete(member);

        cacheService.invalidatePattern(CacheKeyBuilder.progressPattern());
        log.info("Removed user {} from appraisal group {}", userId, groupId);
    }

    @Transactional(readOnly = true)
    public List<GroupMemberDTO> listMembers(Long groupId, AppraisalActor actor) {
        loadOwned(groupId, actor);
        return memberRepository.findMembersWithUsers(groupId).stream()
                .map(GroupMemberDTO::from)
                .collect(Collectors.toList());
    }

    AppraisalGroup loadOwned(Long groupId, AppraisalActor actor) {
        AppraisalGroup group = groupRepository.findById(groupId)
                .orElseThrow(() -> NotFoundException.of("Appraisal group", groupId));
        if (actor.getRole() == User.UserRole.HR_MANAGER && !actor.is(group.getCreatedById())) {
            throw new ForbiddenException("Access denied to appraisal group " + groupId);
        }
        return group;
    }

    AppraisalGroup loadActive(Long groupId, AppraisalActor actor) {
        AppraisalGroup group = loadOwned(groupId, actor);
        if (group.getStatus() == AppraisalGroup.GroupStatus.INACTIVE) {
            throw new ValidationException("Appraisal group " + groupId + " is inactive");
        }
        return group;
    }
}
