package com.flagship.token_wallet.session;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BillingSessionRepository extends JpaRepository<BillingSessionEntity, UUID> {

    /**
     * Loads a session with a row lock (SELECT ... FOR UPDATE).
     * Ticks for one session are serialized on this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM BillingSessionEntity s WHERE s.sessionId = :sessionId")
    Optional<BillingSessionEntity> findByIdForUpdate(@Param("sessionId") UUID sessionId);

    /**
     * Sessions of one type in the given state with no activity since the cutoff, oldest first.
     */
    @Query("""
        SELECT s.sessionId FROM BillingSessionEntity s
        WHERE s.state = :state AND s.sessionType = :sessionType AND s.lastActivityAt < :cutoff
        ORDER BY s.lastActivityAt ASC
        """)
    List<UUID> findIdleSessionIds(@Param("state") SessionState state,
                                  @Param("sessionType") SessionType sessionType,
                                  @Param("cutoff") Instant cutoff,
                                  Pageable pageable);

    long countByState(SessionState state);
}
