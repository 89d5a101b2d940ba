package com.appraisehub.backend.config;

import com.appraisehub.backend.dto.ProgressReport;
import com.appraisehub.backend.entity.Evaluation;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisConfigTest {

    private final ObjectMapper mapper = RedisConfig.cacheMapper();

    @Test
    @DisplayName("cached progress reads back as a progress report")
    void progressReportKeepsItsType() throws Exception {
        ProgressReport.EmployeeProgress entry = new ProgressReport.EmployeeProgress();
        entry.setEmployeeId(5L);
        entry.setStatus(Evaluation.EvaluationStatus.REVIEWED);
        entry.setIsCompleted(false);
        entry.setLastUpdated(LocalDateTime.of(2026, 3, 14, 17, 30));
        ProgressReport report = new ProgressReport();
        report.setCampaignId(42L);
        report.setTotalEmployees(1);
        report.getEmployeeProgress().add(entry);

        Object restored = mapper.readValue(mapper.writeValueAsString(report), Object.class);

        assertThat(restored).isInstanceOf(ProgressReport.class).isEqualTo(report);
    }

    @Test
    @DisplayName("type ids outside the application's DTOs are refused")
    void foreignTypeRejected() {
        String json = "{\"@class\":\"java.net.URL\",\"protocol\":\"http\",\"host\":\"example.com\"}";

        assertThatThrownBy(() -> mapper.readValue(json, Object.class))
                .isInstanceOf(InvalidTypeIdException.class);
    }
}
