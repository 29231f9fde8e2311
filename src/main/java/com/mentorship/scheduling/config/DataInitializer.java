package com.mentorship.scheduling.config;

import com.mentorship.scheduling.entity.AvailabilityBreak;
import com.mentorship.scheduling.entity.AvailabilityRule;
import com.mentorship.scheduling.entity.UserAccount;
import com.mentorship.scheduling.entity.UserRole;
import com.mentorship.scheduling.repository.AvailabilityRuleRepository;
import com.mentorship.scheduling.repository.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent demo seeder: inserts two mentors with weekday availability and two mentees if no
 * mentor exists yet. Safe to re-run. Enabled with {@code scheduling.seed-demo-data=true}.
 */
@Component
@ConditionalOnProperty(name = "scheduling.seed-demo-data", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final UserAccountRepository userAccountRepository;
    private final AvailabilityRuleRepository ruleRepository;

    public DataInitializer(UserAccountRepository userAccountRepository,
                           AvailabilityRuleRepository ruleRepository) {
        this.userAccountRepository = userAccountRepository;
        this.ruleRepository = ruleRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    @Transactional
    public void seed() {
        List<UserAccount> mentors = userAccountRepository.findByRoleOrderByDisplayName(UserRole.MENTOR);
        if (mentors.isEmpty()) {
            log.info("Seeding demo mentors...");
            mentors = List.of(
                    userAccountRepository.save(UserAccount.builder().displayName("Grace Okafor").email("grace@mentorship.local").timezone("Europe/London").role(UserRole.MENTOR).build()),
                    userAccountRepository.save(UserAccount.builder().displayName("Daniel Reyes").email("daniel@mentorship.local").timezone("America/New_York").role(UserRole.MENTOR).build())
            );
        }
        if (userAccountRepository.findByRoleOrderByDisplayName(UserRole.MENTEE).isEmpty()) {
            userAccountRepository.save(UserAccount.builder().displayName("Amara Lee").email("amara@mentorship.local").timezone("Europe/London").role(UserRole.MENTEE).build());
            userAccountRepository.save(UserAccount.builder().displayName("Tomás Silva").email("tomas@mentorship.local").timezone("America/Sao_Paulo").role(UserRole.MENTEE).build());
        }

        for (UserAccount m : mentors) {
            if (ruleRepository.findByMentorIdOrderByDayOfWeekAscStartTimeAsc(m.getId()).isEmpty()) {
                // Monday to Friday
                for (int day = 1; day <= 5; day++) {
                    List<AvailabilityBreak> breaks = new ArrayList<>();
                    breaks.add(AvailabilityBreak.builder().startTime(LocalTime.of(12, 0)).endTime(LocalTime.of(13, 0)).reason("Lunch").build());
                    ruleRepository.save(AvailabilityRule.builder()
                            .mentorId(m.getId())
                            .dayOfWeek(day)
                            .startTime(LocalTime.of(9, 0))
                            .endTime(LocalTime.of(17, 0))
                            .slotDurationMinutes(30)
                            .timezone(m.getTimezone())
                            .breaks(breaks)
                            .build());
                }
                log.info("Added weekday availability for {}", m.getDisplayName());
            }
        }
        log.info("DataInitializer: mentors={}, availability ready", mentors.size());
    }
}
