package com.appraisehub.backend.config;

import com.appraisehub.backend.entity.*;
import com.appraisehub.backend.repository.AppraisalGroupRepository;
import com.appraisehub.backend.repository.FrequencyCalendarRepository;
import com.appraisehub.backend.repository.UserRepository;
import com.appraisehub.backend.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Seeds a small organisation for local development and prints bearer tokens
 * for each seeded user.
 */
@Configuration
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DatabaseInitializer {

    private final UserRepository userRepository;
    private final AppraisalGroupRepository groupRepository;
    private final FrequencyCalendarRepository calendarRepository;
    private final JwtTokenProvider tokenProvider;
    private final Clock clock;

    @Bean
    public CommandLineRunner initDatabase() {
        return args -> seed();
    }

    void seed() {
        if (userRepository.existsByEmail("hr@appraisehub.dev")) {
            log.info("Dev data already exists. Skipping initialization.");
            return;
        }

        log.info("Initializing dev data...");
        LocalDate today = LocalDate.now(clock);

        User admin = userRepository.save(user("admin@appraisehub.dev", "Ada Admin", "EMP-0001",
                User.UserRole.ADMIN, today.minusYears(6), null));
        User hr = userRepository.save(user("hr@appraisehub.dev", "Hana Hr", "EMP-0002",
                User.UserRole.HR_MANAGER, today.minusYears(4), null));
        User manager = userRepository.save(user("manager@appraisehub.dev", "Milo Manager", "EMP-0003",
                User.UserRole.MANAGER, today.minusYears(3), null));
        User senior = userRepository.save(user("senior@appraisehub.dev", "Sam Senior", "EMP-0004",
                User.UserRole.EMPLOYEE, today.minusYears(2), manager.getId()));
        User junior = userRepository.save(user("junior@appraisehub.dev", "Jo Junior", "EMP-0005",
                User.UserRole.EMPLOYEE, today.minusMonths(4), manager.getId()));

        AppraisalGroup group = new AppraisalGroup();
        group.setName("Engineering");
        group.setDescription("Engineering department review group");
        group.setCreatedById(hr.getId());
        for (User member : new User[]{manager, senior, junior}) {
            AppraisalGroupMember m = new AppraisalGroupMember();
            m.setAppraisalGroup(group);
            m.setUser(member);
            m.setAddedById(hr.getId());
            m.setAddedAt(LocalDateTime.now(clock));
            group.getMembers().add(m);
        }
        group = groupRepository.save(group);
        log.info("Created group '{}' (ID: {}) with {} members", group.getName(), group.getId(), group.getMembers().size());

        FrequencyCalendar calendar = new FrequencyCalendar();
        calendar.setCode("QUARTERLY-" + today.getYear());
        calendar.setDescription("Quarterly reviews " + today.getYear());
        calendar.setCreatedById(hr.getId());
        for (int quarter = 1; quarter <= 4; quarter++) {
            LocalDate start = LocalDate.of(today.getYear(), quarter * 3 - 2, 1);
            FrequencyCalendarDetail detail = new FrequencyCalendarDetail();
            detail.setFrequencyCalendar(calendar);
            detail.setDisplayName("Q" + quarter + " " + today.getYear());
            detail.setStartDate(start);
            detail.setEndDate(start.plusMonths(3).minusDays(1));
            calendar.getDetails().add(detail);
        }
        calendar = calendarRepository.save(calendar);
        log.info("Created frequency calendar {} (ID: {})", calendar.getCode(), calendar.getId());

        log.info("Dev data initialization complete. Bearer tokens (valid 7 days):");
        for (User u : new User[]{admin, hr, manager, senior, junior}) {
            log.info("   {} ({}): {}", u.getEmail(), u.getRole(),
                    tokenProvider.generateToken(u.getId(), u.getRole(), Duration.ofDays(7)));
        }
    }

    private static User user(String email, String name, String code, User.UserRole role,
                             LocalDate joined, Long managerId) {
        User user = new User();
        user.setEmail(email);
        user.setFullName(name);
        user.setCode(code);
        user.setRole(role);
        user.setDepartment("Engineering");
        user.setDesignation(role == User.UserRole.EMPLOYEE ? "Software Engineer" : role.name());
        user.setDateOfJoining(joined);
        user.setReportingManagerId(managerId);
        user.setIsActive(true);
        return user;
    }
}
