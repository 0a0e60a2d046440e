package com.unifiedinbox.service;

import com.unifiedinbox.dto.ProviderCredential;
import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.exception.AuthExpiredException;
import com.unifiedinbox.exception.KeyMismatchException;
import com.unifiedinbox.repository.EmailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Owns the credential fields of an account. Every provider data call goes
 * through {@link #ensureValid} first.
 */
@Service
@Slf4j
public class CredentialManager {

    private static final int DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final EmailAccountRepository accountRepository;
    private final MailProviderRegistry providers;
    private final TokenCipher tokenCipher;
    private final Clock clock;
    private final Duration safetyMargin;

    public CredentialManager(EmailAccountRepository accountRepository,
                             MailProviderRegistry providers,
                             TokenCipher tokenCipher,
                             Clock clock,
                             @Value("${sync.token-safety-margin:PT5M}") Duration safetyMargin) {
        this.accountRepository = accountRepository;
        this.providers = providers;
        this.tokenCipher = tokenCipher;
        this.clock = clock;
        this.safetyMargin = safetyMargin;
    }

    /**
     * Returns an access token that stays valid for at least the safety margin,
     * refreshing it first when needed.
     *
     * @throws AuthExpiredException if the account can no longer be refreshed; it is deactivated
     */
    public String ensureValid(EmailAccount account) {
        String accessToken = account.getAccessToken();
        Instant expiresAt = account.getTokenExpiresAt();
        if (accessToken != null && !accessToken.isEmpty()
                && expiresAt != null && expiresAt.isAfter(clock.instant().plus(safetyMargin))) {
            return accessToken;
        }
        log.debug("Access token for account {} expires at {}, refreshing", account.getId(), expiresAt);
        return refresh(account);
    }

    /**
     * Refreshes regardless of the stored expiry. Used after the provider rejected the token.
     */
    public String forceRefresh(EmailAccount account) {
        return refresh(account);
    }

    public void deactivate(EmailAccount account, String reason) {
        account.setActive(false);
        account.setLastSyncError("Re-authorization required: " + reason);
        accountRepository.save(account);
        log.warn("Deactivated account {} ({}): {}", account.getId(), account.getEmailAddress(), reason);
    }

    private String refresh(EmailAccount account) {
        String encrypted = account.getEncryptedRefreshToken();
        if (encrypted == null || encrypted.isEmpty()) {
            deactivate(account, "no refresh token stored");
            throw new AuthExpiredException("No refresh token available for account " + account.getId());
        }

        try {
            String refreshToken = tokenCipher.decrypt(encrypted);
            ProviderCredential credential = providers.forProvider(account.getProvider()).refreshCredential(refreshToken);

            int expiresIn = credential.getExpiresIn() != null ? credential.getExpiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
            account.setAccessToken(credential.getAccessToken());
            account.setTokenExpiresAt(clock.instant().plusSeconds(expiresIn));

            // Rotation is provider-dependent; keep the old token unless a new one was issued
            String rotated = credential.getRefreshToken();
            if (rotated != null && !rotated.isEmpty() && !rotated.equals(refreshToken)) {
                account.setEncryptedRefreshToken(tokenCipher.encrypt(rotated));
                log.debug("Stored rotated refresh token for account {}", account.getId());
            }

            accountRepository.save(account);
            log.info("Refreshed access token for account {}", account.getId());
            return credential.getAccessToken();
        } catch (KeyMismatchException e) {
            deactivate(account, "stored refresh token cannot be decrypted");
            throw new AuthExpiredException("Refresh token for account " + account.getId() + " is unreadable", e);
        } catch (AuthExpiredException e) {
            deactivate(account, e.getMessage());
            throw e;
        }
    }
}
