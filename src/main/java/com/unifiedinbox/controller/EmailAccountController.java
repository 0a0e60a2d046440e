package com.unifiedinbox.controller;

import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.repository.EmailAccountRepository;
import com.unifiedinbox.service.BackgroundSyncService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/accounts")
public class EmailAccountController {

    private final EmailAccountRepository emailAccountRepository;
    private final BackgroundSyncService backgroundSyncService;

    public EmailAccountController(EmailAccountRepository emailAccountRepository,
                                  BackgroundSyncService backgroundSyncService) {
        this.emailAccountRepository = emailAccountRepository;
        this.backgroundSyncService = backgroundSyncService;
    }

    @GetMapping
    public ResponseEntity<?> listAccounts(@RequestHeader(value = "X-User-Id", required = false) Long userId) {
        if (userId == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "X-User-Id header is required"));
        }
        List<Map<String, Object>> accounts = emailAccountRepository.findByUserId(userId).stream()
            .map(EmailAccountController::statusOf)
            .toList();
        return ResponseEntity.ok(accounts);
    }

    /**
     * Queues a sync pass. The pass itself runs on the worker pool.
     */
    @PostMapping("/{id}/sync")
    public ResponseEntity<?> syncAccount(@PathVariable Long id) {
        if (!emailAccountRepository.existsById(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Account not found"));
        }
        boolean queued = backgroundSyncService.requestSync(id);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "accountId", id,
            "queued", queued
        ));
    }

    @GetMapping("/{id}/sync-status")
    public ResponseEntity<?> syncStatus(@PathVariable Long id) {
        return emailAccountRepository.findById(id)
            .<ResponseEntity<?>>map(account -> ResponseEntity.ok(statusOf(account)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Account not found")));
    }

    private static Map<String, Object> statusOf(EmailAccount account) {
        // LinkedHashMap: null values are allowed and key order is stable
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("id", account.getId());
        status.put("email", account.getEmailAddress());
        status.put("provider", account.getProvider());
        status.put("active", account.isActive());
        status.put("requiresReauthorization", account.isRequiresReauthorization());
        status.put("lastSyncedAt", account.getLastSyncedAt());
        status.put("lastSyncError", account.getLastSyncError());
        return status;
    }
}
