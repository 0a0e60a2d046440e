package com.unifiedinbox.service;

import com.unifiedinbox.dto.CanonicalMessage;
import com.unifiedinbox.dto.DeltaResult;
import com.unifiedinbox.dto.OutgoingDraft;
import com.unifiedinbox.dto.ProviderCredential;
import com.unifiedinbox.dto.ProviderProfile;
import com.unifiedinbox.dto.ProviderSendResult;
import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.entity.SyncCursor;

import java.util.Map;

/**
 * One external mail API. Implementations translate HTTP failures into the
 * {@code com.unifiedinbox.exception} hierarchy: 401 becomes
 * {@code CredentialRejectedException}, 429/5xx/I-O become
 * {@code TransientProviderException}, any other 4xx becomes
 * {@code PermanentProviderException}.
 *
 * @param <C> the cursor variant this provider understands
 */
public interface MailProviderAdapter<C extends SyncCursor> {

    EmailAccount.EmailProvider provider();

    Class<C> cursorType();

    String authorizeUrl(String state);

    /**
     * @throws com.unifiedinbox.exception.AuthExchangeException on a non-2xx answer
     */
    ProviderCredential exchangeCode(String code);

    /**
     * @throws com.unifiedinbox.exception.AuthExpiredException when the refresh token is invalid or revoked
     */
    ProviderCredential refreshCredential(String refreshToken);

    ProviderProfile getProfile(String accessToken);

    /**
     * Fetches everything after {@code cursor}, or a full window when it is {@code null}.
     * A cursor the provider no longer accepts is replaced by a full fetch; the
     * result then has mode {@code FULL} and a fresh cursor.
     */
    DeltaResult<C> fetchDelta(String accessToken, C cursor);

    /**
     * Pure and total on optional fields. Only a record without a message id is rejected.
     *
     * @throws com.unifiedinbox.exception.MalformedRecordException if the record has no id
     */
    CanonicalMessage parseRecord(Map<String, Object> raw);

    ProviderSendResult sendMessage(String accessToken, OutgoingDraft draft);
}
