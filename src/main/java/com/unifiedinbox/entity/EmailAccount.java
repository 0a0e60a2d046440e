package com.unifiedinbox.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.Instant;

@Entity
@Table(name = "email_accounts", indexes = {
    @Index(name = "idx_email_accounts_user_id", columnList = "userId"),
    @Index(name = "idx_email_accounts_email_address", columnList = "emailAddress")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private String emailAddress;

    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EmailProvider provider;

    // Short-lived, refreshed before every sync
    @JsonIgnore
    @Column(columnDefinition = "TEXT")
    private String accessToken;

    // Ciphertext produced by TokenCipher, never the plain token
    @JsonIgnore
    @Column(columnDefinition = "TEXT")
    private String encryptedRefreshToken;

    @JsonIgnore
    private Instant tokenExpiresAt;

    @JsonIgnore
    @Convert(converter = SyncCursorConverter.class)
    @Column(columnDefinition = "TEXT")
    private SyncCursor syncCursor;

    private Instant lastSyncedAt;

    @Column(length = 1000)
    private String lastSyncError;

    @Column(nullable = false)
    private boolean active = true;

    private Instant createdAt;
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * A deactivated account is only brought back by a new OAuth connection.
     */
    public boolean isRequiresReauthorization() {
        return !active;
    }

    public enum EmailProvider {
        GMAIL, OUTLOOK
    }
}
