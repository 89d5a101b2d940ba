package com.appraisehub.backend.service;

import com.appraisehub.backend.entity.FrequencyCalendar;
import com.appraisehub.backend.entity.FrequencyCalendarDetail;
import com.appraisehub.backend.entity.InitiatedAppraisal;
import com.appraisehub.backend.entity.InitiatedAppraisalDetailTiming;
import com.appraisehub.backend.entity.ScheduledAppraisalTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarTimingResolverTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 15);

    private CalendarTimingResolver resolver;
    private InitiatedAppraisal campaign;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T09:00:00Z"), ZoneOffset.UTC);
        resolver = new CalendarTimingResolver(clock);
        campaign = new InitiatedAppraisal();
        campaign.setId(5L);
        campaign.setDaysToInitiate(7);
        campaign.setDaysToClose(14);
        campaign.setNumberOfReminders(2);
    }

    private static FrequencyCalendarDetail detail(long id, String name, LocalDate start, LocalDate end) {
        FrequencyCalendarDetail detail = new FrequencyCalendarDetail();
        detail.setId(id);
        detail.setDisplayName(name);
        detail.setStartDate(start);
        detail.setEndDate(end);
        return detail;
    }

    @Test
    @DisplayName("without a calendar a single default period starts from today")
    void defaultPeriod() {
        List<CalendarTimingResolver.PeriodTiming> timings = resolver.resolve(campaign);

        assertThat(timings).hasSize(1);
        CalendarTimingResolver.PeriodTiming timing = timings.get(0);
        assertThat(timing.getPeriodKey()).isEqualTo(ScheduledAppraisalTask.DEFAULT_PERIOD_KEY);
        assertThat(timing.getFrequencyCalendarDetailId()).isNull();
        assertThat(timing.getInitiateDate()).isEqualTo(TODAY.plusDays(7));
        assertThat(timing.getCloseDate()).isEqualTo(TODAY.plusDays(21));
        assertThat(timing.getReminderDates()).hasSize(2);
    }

    @Nested
    @DisplayName("Calendar periods")
    class CalendarPeriods {

        private FrequencyCalendar calendar;

        @BeforeEach
        void setUpCalendar() {
            calendar = new FrequencyCalendar();
            calendar.setId(3L);
            calendar.setCode("Q-2026");
            calendar.setDescription("Quarters");
            calendar.setCreatedById(1L);
            campaign.setFrequencyCalendar(calendar);
        }

        @Test
        @DisplayName("each period is offset by the campaign defaults")
        void calendarDefaults() {
            FrequencyCalendarDetail q2 = detail(12, "Q2", LocalDate.of(2026, 4, 1), LocalDate.of(2026, 6, 30));
            FrequencyCalendarDetail q3 = detail(13, "Q3", LocalDate.of(2026, 7, 1), LocalDate.of(2026, 9, 30));
            calendar.getDetails().addAll(List.of(q3, q2));

            List<CalendarTimingResolver.PeriodTiming> timings = resolver.resolve(campaign);

            assertThat(timings).extracting(CalendarTimingResolver.PeriodTiming::getPeriodKey)
                    .containsExactly("detail-12", "detail-13");
            assertThat(timings.get(0).getInitiateDate()).isEqualTo(LocalDate.of(2026, 3, 25));
            assertThat(timings.get(0).getCloseDate()).isEqualTo(LocalDate.of(2026, 7, 14));
        }

        @Test
        @DisplayName("dates in the past are moved to today")
        void pastDatesClamped() {
            calendar.getDetails().add(detail(11, "Q1", LocalDate.of(2026, 1, 1), LocalDate.of(2026, 3, 31)));

            CalendarTimingResolver.PeriodTiming timing = resolver.resolve(campaign).get(0);

            assertThat(timing.getInitiateDate()).isEqualTo(TODAY);
            assertThat(timing.getCloseDate()).isEqualTo(LocalDate.of(2026, 4, 14));
        }

        @Test
        @DisplayName("per-period timings replace the calendar defaults")
        void detailTimingsWin() {
            FrequencyCalendarDetail q2 = detail(12, "Q2", LocalDate.of(2026, 4, 1), LocalDate.of(2026, 6, 30));
            FrequencyCalendarDetail q3 = detail(13, "Q3", LocalDate.of(2026, 7, 1), LocalDate.of(2026, 9, 30));
            calendar.getDetails().addAll(List.of(q2, q3));

            InitiatedAppraisalDetailTiming override = new InitiatedAppraisalDetailTiming();
            override.setFrequencyCalendarDetail(q3);
            override.setDaysToInitiate(0);
            override.setDaysToClose(5);
            override.setNumberOfReminders(0);
            campaign.addDetailTiming(override);

            List<CalendarTimingResolver.PeriodTiming> timings = resolver.resolve(campaign);

            assertThat(timings).hasSize(1);
            assertThat(timings.get(0).getFrequencyCalendarDetailId()).isEqualTo(13L);
            assertThat(timings.get(0).getInitiateDate()).isEqualTo(LocalDate.of(2026, 7, 1));
            assertThat(timings.get(0).getCloseDate()).isEqualTo(LocalDate.of(2026, 10, 5));
            assertThat(timings.get(0).getReminderDates()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Reminder dates")
    class ReminderDates {

        @Test
        @DisplayName("spread evenly back from the close date")
        void evenSpread() {
            List<LocalDate> dates = CalendarTimingResolver.reminderDates(
                    LocalDate.of(2026, 4, 1), LocalDate.of(2026, 4, 30), 2);

            assertThat(dates).containsExactly(LocalDate.of(2026, 4, 12), LocalDate.of(2026, 4, 21));
        }

        @Test
        @DisplayName("a short window yields fewer distinct dates")
        void shortWindow() {
            List<LocalDate> dates = CalendarTimingResolver.reminderDates(
                    LocalDate.of(2026, 4, 1), LocalDate.of(2026, 4, 3), 5);

            assertThat(dates).containsExactly(LocalDate.of(2026, 4, 1), LocalDate.of(2026, 4, 2));
        }

        @Test
        @DisplayName("no reminders when asked for none or the window is empty")
        void none() {
            assertThat(CalendarTimingResolver.reminderDates(TODAY, TODAY.plusDays(10), 0)).isEmpty();
            assertThat(CalendarTimingResolver.reminderDates(TODAY, TODAY, 3)).isEmpty();
        }
    }
}
