package com.unifiedinbox.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.Instant;

/**
 * Provider-side conversation. Provider thread ids are only unique per account.
 */
@Entity
@Table(name = "threads",
    uniqueConstraints = @UniqueConstraint(name = "ux_threads_account_provider_thread",
        columnNames = {"accountId", "providerThreadId"}),
    indexes = {
        @Index(name = "idx_threads_account_id", columnList = "accountId"),
        @Index(name = "idx_threads_last_message_at", columnList = "lastMessageAt")
    })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MailThread {

    public static final int PROVIDER_THREAD_ID_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long accountId;

    @Column(nullable = false, length = PROVIDER_THREAD_ID_LENGTH)
    private String providerThreadId;

    @Column(columnDefinition = "TEXT")
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String snippet;

    private Instant lastMessageAt;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
