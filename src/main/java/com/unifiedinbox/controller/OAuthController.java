package com.unifiedinbox.controller;

import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.exception.AuthExchangeException;
import com.unifiedinbox.service.AccountConnectionService;
import com.unifiedinbox.service.BackgroundSyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/oauth")
@Slf4j
public class OAuthController {

    private final AccountConnectionService connectionService;
    private final BackgroundSyncService backgroundSyncService;

    public OAuthController(AccountConnectionService connectionService,
                           BackgroundSyncService backgroundSyncService) {
        this.connectionService = connectionService;
        this.backgroundSyncService = backgroundSyncService;
    }

    /**
     * Initiate OAuth flow - returns URL to redirect user to
     */
    @GetMapping("/authorize/{provider}")
    public ResponseEntity<?> authorize(@PathVariable String provider, @RequestParam Long userId) {
        EmailAccount.EmailProvider emailProvider = parseProvider(provider);
        if (emailProvider == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown provider: " + provider));
        }

        // Encode userId in state for retrieval in callback
        String state = userId + ":" + UUID.randomUUID();
        return ResponseEntity.ok(Map.of(
            "authUrl", connectionService.authorizationUrl(emailProvider, state),
            "state", state
        ));
    }

    /**
     * OAuth callback - exchanges code for tokens and queues the first sync
     */
    @GetMapping("/callback/{provider}")
    public ResponseEntity<?> callback(
            @PathVariable String provider,
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error) {

        if (error != null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Authorization denied: " + error));
        }
        EmailAccount.EmailProvider emailProvider = parseProvider(provider);
        if (emailProvider == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown provider: " + provider));
        }
        Long userId = userIdFromState(state);
        if (code == null || userId == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing code or state"));
        }

        try {
            EmailAccount account = connectionService.connect(userId, emailProvider, code);
            boolean queued = backgroundSyncService.requestSync(account.getId());
            return ResponseEntity.ok(Map.of(
                "accountId", account.getId(),
                "email", account.getEmailAddress(),
                "provider", account.getProvider(),
                "syncQueued", queued
            ));
        } catch (AuthExchangeException e) {
            log.warn("OAuth code exchange with {} failed: {}", emailProvider, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    private static EmailAccount.EmailProvider parseProvider(String provider) {
        return switch (provider.toLowerCase()) {
            case "google", "gmail" -> EmailAccount.EmailProvider.GMAIL;
            case "microsoft", "outlook" -> EmailAccount.EmailProvider.OUTLOOK;
            default -> null;
        };
    }

    // State format: "userId:uuid"
    private static Long userIdFromState(String state) {
        if (state == null || !state.contains(":")) {
            return null;
        }
        try {
            return Long.parseLong(state.substring(0, state.indexOf(':')));
        } catch (NumberFormatException e) {
            log.warn("Ignoring OAuth callback with unreadable state {}", state);
            return null;
        }
    }
}
