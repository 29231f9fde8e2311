package com.mentorship.scheduling.repository;

import com.mentorship.scheduling.entity.AvailabilityRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AvailabilityRuleRepository extends JpaRepository<AvailabilityRule, Long> {

    List<AvailabilityRule> findByMentorIdOrderByDayOfWeekAscStartTimeAsc(Long mentorId);

    Optional<AvailabilityRule> findFirstByMentorIdAndRecurringFalseAndSpecificDate(Long mentorId, LocalDate specificDate);

    Optional<AvailabilityRule> findFirstByMentorIdAndRecurringTrueAndDayOfWeek(Long mentorId, int dayOfWeek);
}
