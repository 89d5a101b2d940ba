package com.appraisehub.backend.service;

import com.appraisehub.backend.entity.FrequencyCalendarDetail;
import com.appraisehub.backend.entity.InitiatedAppraisal;
import com.appraisehub.backend.entity.InitiatedAppraisalDetailTiming;
import com.appraisehub.backend.entity.ScheduledAppraisalTask;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Turns a campaign's calendar binding into concrete dates per period.
 * <p>
 * Per-period timings win over the calendar; without either a single
 * "default" period is derived from today. Dates that fall in the past are
 * moved to today.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CalendarTimingResolver {

    private final Clock clock;

    public List<PeriodTiming> resolve(InitiatedAppraisal campaign) {
        LocalDate today = LocalDate.now(clock);
        List<PeriodTiming> timings = new ArrayList<>();

        if (!campaign.getDetailTimings().isEmpty()) {
            List<InitiatedAppraisalDetailTiming> overrides = new ArrayList<>(campaign.getDetailTimings());
            overrides.sort(Comparator.comparing(t -> t.getFrequencyCalendarDetail().getStartDate()));
            for (InitiatedAppraisalDetailTiming override : overrides) {
                timings.add(forPeriod(campaign, override.getFrequencyCalendarDetail(),
                        override.getDaysToInitiate(), override.getDaysToClose(),
                        override.getNumberOfReminders(), today));
            }
        } else if (campaign.getFrequencyCalendar() != null) {
            for (FrequencyCalendarDetail detail : campaign.getFrequencyCalendar().getDetails()) {
                timings.add(forPeriod(campaign, detail, campaign.getDaysToInitiate(),
                        campaign.getDaysToClose(), campaign.getNumberOfReminders(), today));
            }
            timings.sort(Comparator.comparing(PeriodTiming::getInitiateDate));
        } else {
            LocalDate initiate = today.plusDays(orZero(campaign.getDaysToInitiate()));
            LocalDate close = initiate.plusDays(orZero(campaign.getDaysToClose()));
            timings.add(new PeriodTiming(ScheduledAppraisalTask.DEFAULT_PERIOD_KEY, null, "Default",
                    initiate, close, reminderDates(initiate, close, orZero(campaign.getNumberOfReminders()))));
        }

        return timings;
    }

    private PeriodTiming forPeriod(InitiatedAppraisal campaign, FrequencyCalendarDetail detail,
                                   Integer daysToInitiate, Integer daysToClose, Integer reminders,
                                   LocalDate today) {
        LocalDate initiate = clamp(detail.getStartDate().minusDays(orZero(daysToInitiate)), today,
                campaign, detail, "initiate");
        LocalDate close = clamp(detail.getEndDate().plusDays(orZero(daysToClose)), today,
                campaign, detail, "close");
        return new PeriodTiming(periodKey(detail), detail.getId(), detail.getDisplayName(),
                initiate, close, reminderDates(initiate, close, orZero(reminders)));
    }

    private LocalDate clamp(LocalDate date, LocalDate today, InitiatedAppraisal campaign,
                            FrequencyCalendarDetail detail, String label) {
        if (date.isBefore(today)) {
            log.warn("Campaign {} period '{}': {} date {} is in the past, using {}",
                    campaign.getId(), detail.getDisplayName(), label, date, today);
            return today;
        }
        return date;
    }

    /**
     * Up to {@code count} dates counted back from {@code close} at an even
     * interval, never before {@code initiate}. Ascending, no duplicates.
     */
    static List<LocalDate> reminderDates(LocalDate initiate, LocalDate close, int count) {
        if (count <= 0 || !close.isAfter(initiate)) {
            return new ArrayList<>();
        }
        long span = ChronoUnit.DAYS.between(initiate, close);
        long interval = Math.max(1, span / (count + 1));

        TreeSet<LocalDate> dates = new TreeSet<>();
        for (int i = 1; i <= count; i++) {
            LocalDate date = close.minusDays(interval * i);
            if (date.isBefore(initiate)) {
                break;
            }
            dates.add(date);
        }
        return new ArrayList<>(dates);
    }

    public static String periodKey(FrequencyCalendarDetail detail) {
        return "detail-" + detail.getId();
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PeriodTiming {
        private String periodKey;
        private Long frequencyCalendarDetailId; // null for the default period
        private String displayName;
        private LocalDate initiateDate;
        private LocalDate closeDate;
        private List<LocalDate> reminderDates = new ArrayList<>();
    }
}
