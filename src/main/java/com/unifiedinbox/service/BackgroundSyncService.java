package com.unifiedinbox.service;

import com.unifiedinbox.dto.RetryDecision;
import com.unifiedinbox.dto.SyncResult;
import com.unifiedinbox.repository.EmailAccountRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Periodically enqueues every active account and runs the passes on a bounded
 * worker pool. Failed passes are rescheduled according to {@link SyncRetryPolicy}.
 */
@Service
@Slf4j
public class BackgroundSyncService {

    private final EmailAccountRepository accountRepository;
    private final MailSyncService mailSyncService;
    private final SyncRetryPolicy retryPolicy;
    private final ThreadPoolTaskExecutor workers;
    private final TaskScheduler retryScheduler;
    private final Clock clock;

    // Accounts waiting for or running a pass from this process
    private final Set<Long> queued = ConcurrentHashMap.newKeySet();
    private volatile boolean accepting = true;

    public BackgroundSyncService(EmailAccountRepository accountRepository,
                                 MailSyncService mailSyncService,
                                 SyncRetryPolicy retryPolicy,
                                 @Qualifier("syncWorkers") ThreadPoolTaskExecutor workers,
                                 @Qualifier("syncRetryScheduler") TaskScheduler retryScheduler,
                                 Clock clock) {
        this.accountRepository = accountRepository;
        this.mailSyncService = mailSyncService;
        this.retryPolicy = retryPolicy;
        this.workers = workers;
        this.retryScheduler = retryScheduler;
        this.clock = clock;
    }

    /**
     * Runs every {@code sync.interval-minutes}, measured from the end of the previous tick.
     */
    @Scheduled(fixedDelayString = "${sync.interval-minutes:5}",
               initialDelayString = "${sync.initial-delay-minutes:1}",
               timeUnit = TimeUnit.MINUTES)
    public void syncAllAccounts() {
        if (!accepting) {
            return;
        }
        List<Long> accountIds = accountRepository.findActiveAccountIds();
        int enqueued = 0;
        for (Long accountId : accountIds) {
            if (enqueue(accountId, 0)) {
                enqueued++;
            }
        }
        log.info("Sync tick: {} active accounts, {} enqueued", accountIds.size(), enqueued);
    }

    /**
     * Manual trigger. Returns false when the account already has a pass queued
     * or the pool is full.
     */
    public boolean requestSync(Long accountId) {
        return enqueue(accountId, 0);
    }

    boolean enqueue(Long accountId, int attempt) {
        if (!accepting || !queued.add(accountId)) {
            return false;
        }
        try {
            workers.execute(() -> runPass(accountId, attempt));
            return true;
        } catch (TaskRejectedException e) {
            queued.remove(accountId);
            log.warn("Sync queue full, account {} waits for the next tick", accountId);
            return false;
        }
    }

    private void runPass(Long accountId, int attempt) {
        if (!accepting) {
            queued.remove(accountId);
            log.debug("Dropping queued pass for account {}, scheduler is stopping", accountId);
            return;
        }
        SyncResult result;
        try {
            result = mailSyncService.sync(accountId);
        } finally {
            queued.remove(accountId);
        }

        if (result.getStatus() != SyncResult.Status.FAILED) {
            return;
        }

        RetryDecision decision = retryPolicy.decide(result.getErrorKind(), attempt);
        switch (decision.getAction()) {
            case RETRY -> {
                log.info("Retrying account {} in {} (attempt {})", accountId, decision.getDelay(), attempt + 1);
                retryScheduler.schedule(() -> enqueue(accountId, attempt + 1),
                    clock.instant().plus(decision.getDelay()));
            }
            case DEACTIVATE -> log.warn("Account {} is deactivated until the user reconnects it", accountId);
            case ABANDON -> log.warn("Giving up on account {} until the next tick: {}", accountId, result.getReason());
        }
    }

    boolean isQueued(Long accountId) {
        return queued.contains(accountId);
    }

    @PreDestroy
    public void stopAccepting() {
        accepting = false;
        log.info("Sync scheduler stopping, {} accounts still queued", queued.size());
    }
}
