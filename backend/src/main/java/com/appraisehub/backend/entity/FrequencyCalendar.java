package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;

/**
 * A reusable schedule of review periods, e.g. the four quarters of a year.
 */
@Entity
@Table(name = "frequency_calendars")
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class FrequencyCalendar extends BaseEntity {

    @Column(nullable = false, length = 50)
    private String code;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_by_id", nullable = false)
    private Long createdById;

    @Column(name = "is_active")
    private Boolean isActive = true;

    @OneToMany(mappedBy = "frequencyCalendar", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("startDate ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<FrequencyCalendarDetail> details = new ArrayList<>();
}
