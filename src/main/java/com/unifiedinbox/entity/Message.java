package com.unifiedinbox.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_thread_id", columnList = "threadId"),
    @Index(name = "idx_messages_sent_at", columnList = "sentAt")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final int PROVIDER_MESSAGE_ID_LENGTH = 512;
    public static final int FROM_ADDRESS_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long threadId;

    // Idempotency key for ingestion, unique across all accounts
    @Column(nullable = false, unique = true, length = PROVIDER_MESSAGE_ID_LENGTH)
    private String providerMessageId;

    @Column(nullable = false, length = FROM_ADDRESS_LENGTH)
    private String fromAddress;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> toAddresses = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> ccAddresses = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> bccAddresses = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String subject;

    private Instant sentAt;

    @Column(columnDefinition = "TEXT")
    private String bodyText;

    @Column(columnDefinition = "TEXT")
    private String bodyHtml;

    private boolean hasAttachments;

    private boolean isRead;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
