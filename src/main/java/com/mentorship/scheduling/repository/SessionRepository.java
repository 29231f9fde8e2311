package com.mentorship.scheduling.repository;

import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.entity.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SessionRepository extends JpaRepository<Session, Long>, JpaSpecificationExecutor<Session> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Session s WHERE s.id = :id")
    Optional<Session> findByIdForUpdate(@Param("id") Long id);

    /**
     * Sessions of a mentor starting in [from, to) that still hold their slot.
     */
    @Query("SELECT s FROM Session s WHERE s.mentorId = :mentorId AND s.status IN :statuses "
            + "AND s.scheduledAt >= :from AND s.scheduledAt < :to ORDER BY s.scheduledAt ASC")
    List<Session> findByMentorInWindow(@Param("mentorId") Long mentorId,
                                       @Param("statuses") Collection<SessionStatus> statuses,
                                       @Param("from") Instant from,
                                       @Param("to") Instant to);

    List<Session> findByStatusInAndScheduledAtBeforeOrderByScheduledAtAsc(Collection<SessionStatus> statuses, Instant before);
}
