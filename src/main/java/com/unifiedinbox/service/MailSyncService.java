package com.unifiedinbox.service;

import com.unifiedinbox.dto.CanonicalMessage;
import com.unifiedinbox.dto.DeltaResult;
import com.unifiedinbox.dto.ErrorKind;
import com.unifiedinbox.dto.SyncResult;
import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.entity.SyncCursor;
import com.unifiedinbox.exception.AuthExpiredException;
import com.unifiedinbox.exception.CredentialRejectedException;
import com.unifiedinbox.exception.MalformedRecordException;
import com.unifiedinbox.exception.PermanentProviderException;
import com.unifiedinbox.exception.TransientProviderException;
import com.unifiedinbox.repository.EmailAccountRepository;
import com.unifiedinbox.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs one sync pass for one account: lease, credentials, fetch, parse, write.
 * Never throws; every outcome is reported as a {@link SyncResult}.
 */
@Service
@Slf4j
public class MailSyncService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final EmailAccountRepository accountRepository;
    private final MessageRepository messageRepository;
    private final MailProviderRegistry providers;
    private final CredentialManager credentialManager;
    private final MailboxWriter mailboxWriter;
    private final SyncLeaseService leaseService;
    private final AsyncTaskExecutor fetchExecutor;
    private final Duration timeBudget;
    private final int maxWriteAttempts;

    public MailSyncService(EmailAccountRepository accountRepository,
                           MessageRepository messageRepository,
                           MailProviderRegistry providers,
                           CredentialManager credentialManager,
                           MailboxWriter mailboxWriter,
                           SyncLeaseService leaseService,
                           @Qualifier("providerFetchExecutor") AsyncTaskExecutor fetchExecutor,
                           @Value("${sync.time-budget:PT4M}") Duration timeBudget,
                           @Value("${sync.write-attempts:3}") int maxWriteAttempts) {
        this.accountRepository = accountRepository;
        this.messageRepository = messageRepository;
        this.providers = providers;
        this.credentialManager = credentialManager;
        this.mailboxWriter = mailboxWriter;
        this.leaseService = leaseService;
        this.fetchExecutor = fetchExecutor;
        this.timeBudget = timeBudget;
        this.maxWriteAttempts = maxWriteAttempts;
    }

    public SyncResult sync(Long accountId) {
        Optional<String> lease = leaseService.tryAcquire(accountId);
        if (lease.isEmpty()) {
            log.debug("Account {} is already being synced, skipping", accountId);
            return SyncResult.skipped("in progress");
        }

        try {
            EmailAccount account = accountRepository.findById(accountId).orElse(null);
            if (account == null) {
                return SyncResult.skipped("account not found");
            }
            if (!account.isActive()) {
                return SyncResult.skipped("account requires re-authorization");
            }
            return run(account);
        } finally {
            leaseService.release(accountId, lease.get());
        }
    }

    private SyncResult run(EmailAccount account) {
        long started = System.currentTimeMillis();
        try {
            int ingested = ingest(account, providers.forProvider(account.getProvider()));
            log.info("Synced account {} ({}): {} new messages in {} ms",
                account.getId(), account.getProvider(), ingested, System.currentTimeMillis() - started);
            return SyncResult.success(ingested);
        } catch (AuthExpiredException e) {
            log.warn("Account {} needs re-authorization: {}", account.getId(), e.getMessage());
            return SyncResult.failed(ErrorKind.AUTH_EXPIRED, truncate(e.getMessage()));
        } catch (TransientProviderException e) {
            log.warn("Transient failure syncing account {}: {}", account.getId(), e.getMessage());
            return failAndRecord(account, ErrorKind.TRANSIENT, e);
        } catch (PermanentProviderException e) {
            log.error("Permanent failure syncing account {}: {}", account.getId(), e.getMessage());
            return failAndRecord(account, ErrorKind.PERMANENT, e);
        } catch (DataAccessException e) {
            log.error("Database failure syncing account {}", account.getId(), e);
            return SyncResult.failed(ErrorKind.TRANSIENT, truncate(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure syncing account {}", account.getId(), e);
            return failAndRecord(account, ErrorKind.TRANSIENT, e);
        }
    }

    private <C extends SyncCursor> int ingest(EmailAccount account, MailProviderAdapter<C> adapter) {
        String accessToken = credentialManager.ensureValid(account);

        SyncCursor stored = account.getSyncCursor();
        C cursor = null;
        if (adapter.cursorType().isInstance(stored)) {
            cursor = adapter.cursorType().cast(stored);
        } else if (stored != null) {
            log.warn("Account {} has a cursor of another provider, starting a full sync", account.getId());
        }

        DeltaResult<C> delta;
        try {
            delta = fetchWithinBudget(adapter, accessToken, cursor);
        } catch (CredentialRejectedException first) {
            log.info("Provider rejected the access token of account {}, refreshing once", account.getId());
            String refreshed = credentialManager.forceRefresh(account);
            try {
                delta = fetchWithinBudget(adapter, refreshed, cursor);
            } catch (CredentialRejectedException second) {
                credentialManager.deactivate(account, "provider rejected a freshly refreshed token");
                throw new AuthExpiredException("Access token rejected after refresh", second);
            }
        }

        List<CanonicalMessage> messages = new ArrayList<>();
        for (Map<String, Object> record : delta.getRecords()) {
            try {
                messages.add(adapter.parseRecord(record));
            } catch (MalformedRecordException e) {
                log.warn("Skipping malformed {} record for account {}: {}",
                    adapter.provider(), account.getId(), e.getMessage());
            }
        }
        log.debug("Account {}: {} fetch returned {} records, {} parsed",
            account.getId(), delta.getMode(), delta.getRecords().size(), messages.size());

        return write(account.getId(), messages, delta.getNextCursor());
    }

    /**
     * A concurrent writer may insert the same provider message between our
     * existence check and our insert. The whole batch is then replayed, and the
     * replay skips what the other writer stored. A violation with no new
     * provider ids stored in the meantime cannot be fixed by a replay.
     */
    private int write(Long accountId, List<CanonicalMessage> messages, SyncCursor nextCursor) {
        Set<String> ids = messages.stream()
            .map(CanonicalMessage::getProviderMessageId)
            .collect(Collectors.toSet());
        long stored = ids.isEmpty() ? 0 : messageRepository.countByProviderMessageIdIn(ids);

        DataIntegrityViolationException last = null;
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            try {
                return mailboxWriter.apply(accountId, messages, nextCursor);
            } catch (DataIntegrityViolationException e) {
                last = e;
                long storedNow = ids.isEmpty() ? 0 : messageRepository.countByProviderMessageIdIn(ids);
                if (storedNow <= stored) {
                    throw new PermanentProviderException(
                        "Batch for account " + accountId + " violates a storage constraint", e);
                }
                stored = storedNow;
                log.info("Write conflict for account {} (attempt {}/{}), replaying batch",
                    accountId, attempt, maxWriteAttempts);
            }
        }
        throw new TransientProviderException("Batch for account " + accountId + " kept conflicting", last);
    }

    private <C extends SyncCursor> DeltaResult<C> fetchWithinBudget(MailProviderAdapter<C> adapter,
                                                                    String accessToken, C cursor) {
        Future<DeltaResult<C>> future = fetchExecutor.submit(() -> adapter.fetchDelta(accessToken, cursor));
        try {
            return future.get(timeBudget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientProviderException("Fetch exceeded the time budget of " + timeBudget, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientProviderException("Interrupted while fetching", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TransientProviderException("Fetch failed", cause);
        }
    }

    private SyncResult failAndRecord(EmailAccount account, ErrorKind kind, RuntimeException e) {
        String message = truncate(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        try {
            accountRepository.recordSyncError(account.getId(), message);
        } catch (DataAccessException dbError) {
            log.error("Could not record sync error for account {}", account.getId(), dbError);
        }
        return SyncResult.failed(kind, message);
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
