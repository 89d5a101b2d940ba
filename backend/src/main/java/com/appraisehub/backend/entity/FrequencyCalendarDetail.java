package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;
import java.time.LocalDate;

@Entity
@Table(name = "frequency_calendar_details", indexes = {
        @Index(name = "idx_detail_calendar", columnList = "frequency_calendar_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class FrequencyCalendarDetail extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "frequency_calendar_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private FrequencyCalendar frequencyCalendar;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName; // e.g. "Q1 2026"

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;
}
