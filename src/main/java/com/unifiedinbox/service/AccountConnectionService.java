package com.unifiedinbox.service;

import com.unifiedinbox.dto.ProviderCredential;
import com.unifiedinbox.dto.ProviderProfile;
import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.repository.EmailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Creates accounts from a completed OAuth consent, and reactivates accounts
 * the sync engine had deactivated.
 */
@Service
@Slf4j
public class AccountConnectionService {

    private static final int DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final EmailAccountRepository accountRepository;
    private final MailProviderRegistry providers;
    private final TokenCipher tokenCipher;
    private final Clock clock;

    public AccountConnectionService(EmailAccountRepository accountRepository,
                                    MailProviderRegistry providers,
                                    TokenCipher tokenCipher,
                                    Clock clock) {
        this.accountRepository = accountRepository;
        this.providers = providers;
        this.tokenCipher = tokenCipher;
        this.clock = clock;
    }

    public String authorizationUrl(EmailAccount.EmailProvider provider, String state) {
        return providers.forProvider(provider).authorizeUrl(state);
    }

    /**
     * @throws com.unifiedinbox.exception.AuthExchangeException if the provider refused the code
     */
    public EmailAccount connect(Long userId, EmailAccount.EmailProvider provider, String code) {
        MailProviderAdapter<?> adapter = providers.forProvider(provider);
        ProviderCredential credential = adapter.exchangeCode(code);
        ProviderProfile profile = adapter.getProfile(credential.getAccessToken());

        EmailAccount account = accountRepository
            .findByUserIdAndEmailAddressAndProvider(userId, profile.getEmailAddress(), provider)
            .orElse(null);
        boolean reconnect = account != null;
        if (account == null) {
            account = new EmailAccount();
            account.setUserId(userId);
            account.setEmailAddress(profile.getEmailAddress());
            account.setProvider(provider);
        }

        int expiresIn = credential.getExpiresIn() != null ? credential.getExpiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
        account.setDisplayName(profile.getDisplayName());
        account.setAccessToken(credential.getAccessToken());
        account.setTokenExpiresAt(clock.instant().plusSeconds(expiresIn));
        if (credential.getRefreshToken() != null && !credential.getRefreshToken().isEmpty()) {
            account.setEncryptedRefreshToken(tokenCipher.encrypt(credential.getRefreshToken()));
        } else if (!reconnect) {
            log.warn("{} issued no refresh token for {}; the account deactivates when the access token expires",
                provider, profile.getEmailAddress());
        }
        account.setActive(true);
        account.setLastSyncError(null);

        EmailAccount saved = accountRepository.save(account);
        log.info("{} {} account {} for user {}", reconnect ? "Reconnected" : "Connected",
            provider, saved.getId(), userId);
        return saved;
    }
}
