package com.flagship.token_wallet.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link BillingSession} domain object and its JPA entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionPersistenceService {

    private final BillingSessionRepository repository;

    @Transactional
    public BillingSession save(BillingSession session) {
        BillingSessionEntity saved = repository.save(BillingSessionEntity.fromDomain(session));
        log.debug("Saved session {} in state {}", saved.getSessionId(), saved.getState());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<BillingSession> findById(UUID sessionId) {
        return repository.findById(sessionId).map(BillingSessionEntity::toDomain);
    }

    /**
     * Loads and row-locks a session for the rest of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<BillingSession> lockForUpdate(UUID sessionId) {
        return repository.findByIdForUpdate(sessionId).map(BillingSessionEntity::toDomain);
    }

    /**
     * Writes the session's counters and lifecycle fields. The version check runs at flush,
     * inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BillingSession update(BillingSession session) {
        BillingSessionEntity existing = repository.findById(session.getSessionId())
            .orElseThrow(() -> new IllegalArgumentException("Session not found: " + session.getSessionId()));
        existing.updateFromDomain(session);
        BillingSessionEntity updated = repository.saveAndFlush(existing);
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public List<UUID> findIdleSessionIds(SessionType sessionType, Instant cutoff, int limit) {
        return repository.findIdleSessionIds(SessionState.ACTIVE, sessionType, cutoff, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public long countActive() {
        return repository.countByState(SessionState.ACTIVE);
    }
}
