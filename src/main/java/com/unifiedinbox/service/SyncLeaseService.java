package com.unifiedinbox.service;

import com.unifiedinbox.repository.SyncLeaseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed mutual exclusion per account, shared by every worker and
 * process pointed at the same schema.
 */
@Service
@Slf4j
public class SyncLeaseService {

    private final SyncLeaseRepository leaseRepository;
    private final Clock clock;
    private final Duration leaseTimeout;
    private final String workerId = ManagementFactory.getRuntimeMXBean().getName();

    public SyncLeaseService(SyncLeaseRepository leaseRepository,
                            Clock clock,
                            @Value("${sync.lease-timeout:PT10M}") Duration leaseTimeout) {
        this.leaseRepository = leaseRepository;
        this.clock = clock;
        this.leaseTimeout = leaseTimeout;
    }

    /**
     * @return the holder token to pass to {@link #release}, or empty if another
     *         worker holds an unexpired lease on the account
     */
    public Optional<String> tryAcquire(Long accountId) {
        String holder = workerId + "/" + UUID.randomUUID();
        Instant now = clock.instant();
        Instant expiresAt = now.plus(leaseTimeout);

        if (leaseRepository.takeOverExpired(accountId, holder, now, expiresAt) == 1) {
            log.warn("Took over expired sync lease on account {}", accountId);
            return Optional.of(holder);
        }
        try {
            leaseRepository.insertLease(accountId, holder, now, expiresAt);
            return Optional.of(holder);
        } catch (DataIntegrityViolationException e) {
            // Primary key taken: someone else holds it
            return Optional.empty();
        }
    }

    public void release(Long accountId, String holder) {
        try {
            if (leaseRepository.release(accountId, holder) == 0) {
                log.warn("Sync lease on account {} was already gone or taken over", accountId);
            }
        } catch (DataAccessException e) {
            log.error("Could not release sync lease on account {}; it expires in {}", accountId, leaseTimeout, e);
        }
    }
}
