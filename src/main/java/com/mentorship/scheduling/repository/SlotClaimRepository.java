package com.mentorship.scheduling.repository;

import com.mentorship.scheduling.entity.SlotClaim;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SlotClaimRepository extends JpaRepository<SlotClaim, Long> {

    List<SlotClaim> findBySessionIdOrderByScheduledAt(Long sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = false)
    @Query("DELETE FROM SlotClaim c WHERE c.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") Long sessionId);
}
