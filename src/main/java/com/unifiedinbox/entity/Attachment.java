package com.unifiedinbox.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.Instant;

/**
 * Attachment metadata only; content stays with the provider.
 */
@Entity
@Table(name = "attachments", indexes = {
    @Index(name = "idx_attachments_message_id", columnList = "messageId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Attachment {

    public static final int FILENAME_LENGTH = 1000;
    public static final int MIME_TYPE_LENGTH = 255;
    public static final int PROVIDER_ATTACHMENT_ID_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long messageId;

    @Column(nullable = false, length = FILENAME_LENGTH)
    private String filename;

    private Long size;

    @Column(length = MIME_TYPE_LENGTH)
    private String mimeType;

    @Column(nullable = false, length = PROVIDER_ATTACHMENT_ID_LENGTH)
    private String providerAttachmentId;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
