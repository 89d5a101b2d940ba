package com.appraisehub.backend.repository;

import com.appraisehub.backend.entity.*;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FrequencyCalendarDetailRepository extends JpaRepository<FrequencyCalendarDetail, Long> {
}
