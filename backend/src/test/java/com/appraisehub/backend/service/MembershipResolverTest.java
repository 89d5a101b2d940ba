package com.appraisehub.backend.service;

import com.appraisehub.backend.entity.AppraisalGroup;
import com.appraisehub.backend.entity.AppraisalGroupMember;
import com.appraisehub.backend.entity.User;
import com.appraisehub.backend.exception.NotFoundException;
import com.appraisehub.backend.repository.AppraisalGroupMemberRepository;
import com.appraisehub.backend.repository.AppraisalGroupRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MembershipResolverTest {

    private static final Long GROUP_ID = 7L;

    private AppraisalGroupRepository groupRepository;
    private AppraisalGroupMemberRepository memberRepository;
    private MembershipResolver resolver;

    @BeforeEach
    void setUp() {
        groupRepository = mock(AppraisalGroupRepository.class);
        memberRepository = mock(AppraisalGroupMemberRepository.class);
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T09:00:00Z"), ZoneOffset.UTC);
        resolver = new MembershipResolver(groupRepository, memberRepository, clock);
        when(groupRepository.existsById(GROUP_ID)).thenReturn(true);
    }

    private static User user(long id, LocalDate joined, boolean active) {
        User user = new User();
        user.setId(id);
        user.setEmail("user" + id + "@example.com");
        user.setFullName("User " + id);
        user.setRole(User.UserRole.EMPLOYEE);
        user.setDateOfJoining(joined);
        user.setIsActive(active);
        return user;
    }

    private static AppraisalGroupMember member(User user) {
        AppraisalGroup group = new AppraisalGroup();
        group.setId(GROUP_ID);
        AppraisalGroupMember member = new AppraisalGroupMember();
        member.setAppraisalGroup(group);
        member.setUser(user);
        member.setAddedById(1L);
        member.setAddedAt(LocalDateTime.of(2025, 1, 1, 0, 0));
        return member;
    }

    @Test
    @DisplayName("explicitly excluded members are reported as excluded")
    void explicitExclusion() {
        User a = user(1, LocalDate.of(2020, 1, 1), true);
        User b = user(2, LocalDate.of(2020, 1, 1), true);
        User c = user(3, LocalDate.of(2020, 1, 1), true);
        when(memberRepository.findMembersWithUsers(GROUP_ID)).thenReturn(List.of(member(a), member(b), member(c)));

        MembershipResolver.MembershipResolution resolution = resolver.resolve(GROUP_ID, Set.of(2L), false);

        assertThat(resolution.getEligible()).extracting(User::getId).containsExactly(1L, 3L);
        assertThat(resolution.getExcluded()).extracting(User::getId).containsExactly(2L);
    }

    @Test
    @DisplayName("short tenure exclusion uses a twelve month cutoff and keeps unknown join dates")
    void tenureExclusion() {
        User veteran = user(1, LocalDate.of(2025, 3, 15), true);
        User newcomer = user(2, LocalDate.of(2025, 3, 16), true);
        User unknown = user(3, null, true);
        when(memberRepository.findMembersWithUsers(GROUP_ID))
                .thenReturn(List.of(member(veteran), member(newcomer), member(unknown)));

        MembershipResolver.MembershipResolution resolution = resolver.resolve(GROUP_ID, null, true);

        assertThat(resolution.getEligible()).extracting(User::getId).containsExactly(1L, 3L);
        assertThat(resolution.getExcluded()).extracting(User::getId).containsExactly(2L);
    }

    @Test
    @DisplayName("tenure is ignored unless the campaign asks for it")
    void tenureIgnoredWhenOff() {
        User newcomer = user(2, LocalDate.of(2026, 3, 1), true);
        when(memberRepository.findMembersWithUsers(GROUP_ID)).thenReturn(List.of(member(newcomer)));

        assertThat(resolver.resolve(GROUP_ID, Set.of(), false).getEligible()).hasSize(1);
    }

    @Test
    @DisplayName("inactive users are neither eligible nor excluded")
    void inactiveDropped() {
        User active = user(1, null, true);
        User inactive = user(2, null, false);
        when(memberRepository.findMembersWithUsers(GROUP_ID)).thenReturn(List.of(member(active), member(inactive)));

        MembershipResolver.MembershipResolution resolution = resolver.resolve(GROUP_ID, Set.of(2L), false);

        assertThat(resolution.getEligible()).extracting(User::getId).containsExactly(1L);
        assertThat(resolution.getExcluded()).isEmpty();
    }

    @Test
    @DisplayName("a user listed twice is counted once")
    void duplicatesCollapsed() {
        User a = user(1, null, true);
        when(memberRepository.findMembersWithUsers(GROUP_ID)).thenReturn(List.of(member(a), member(a)));

        assertThat(resolver.resolve(GROUP_ID, null, false).getEligible()).hasSize(1);
    }

    @Test
    @DisplayName("unknown group is reported as not found")
    void unknownGroup() {
        when(groupRepository.existsById(99L)).thenReturn(false);

        assertThatThrownBy(() -> resolver.resolve(99L, null, false))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("99");
    }
}
