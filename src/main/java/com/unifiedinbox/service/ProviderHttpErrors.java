package com.unifiedinbox.service;

import com.unifiedinbox.exception.AuthExpiredException;
import com.unifiedinbox.exception.CredentialRejectedException;
import com.unifiedinbox.exception.MailSyncException;
import com.unifiedinbox.exception.PermanentProviderException;
import com.unifiedinbox.exception.TransientProviderException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;

/**
 * Maps RestTemplate failures onto the sync engine's error kinds.
 */
final class ProviderHttpErrors {

    private ProviderHttpErrors() {
    }

    static MailSyncException translate(String operation, RestClientException e) {
        if (e instanceof HttpStatusCodeException statusError) {
            HttpStatusCode status = statusError.getStatusCode();
            String message = operation + " failed with " + status.value();
            if (status.value() == 401) {
                return new CredentialRejectedException(message, e);
            }
            if (status.value() == 429 || status.is5xxServerError()) {
                return new TransientProviderException(message, e);
            }
            return new PermanentProviderException(message + ": " + statusError.getResponseBodyAsString(), e);
        }
        // I/O errors, timeouts, unreadable bodies
        return new TransientProviderException(operation + " failed: " + e.getMessage(), e);
    }

    /**
     * Token endpoint failures: {@code invalid_grant} or 401 mean the refresh token is dead.
     */
    static MailSyncException translateRefresh(String provider, RestClientException e) {
        if (e instanceof HttpStatusCodeException statusError) {
            int status = statusError.getStatusCode().value();
            String body = statusError.getResponseBodyAsString();
            if (status == 401 || (status == 400 && body.contains("invalid_grant"))) {
                return new AuthExpiredException(provider + " refresh token rejected: " + body, e);
            }
        }
        MailSyncException translated = translate(provider + " token refresh", e);
        if (translated instanceof CredentialRejectedException) {
            return new AuthExpiredException(translated.getMessage(), e);
        }
        return translated;
    }
}
