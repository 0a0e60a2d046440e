package com.unifiedinbox.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Provider-agnostic message produced by an adapter's {@code parseRecord}.
 */
@Data
@Builder
public class CanonicalMessage {
    private String providerMessageId;
    private String providerThreadId;
    @Builder.Default
    private String from = "";
    @Builder.Default
    private List<String> to = List.of();
    @Builder.Default
    private List<String> cc = List.of();
    @Builder.Default
    private List<String> bcc = List.of();
    @Builder.Default
    private String subject = "";
    private Instant date;
    @Builder.Default
    private String bodyText = "";
    @Builder.Default
    private String bodyHtml = "";
    @Builder.Default
    private String snippet = "";
    @Builder.Default
    private List<CanonicalAttachment> attachments = List.of();
    private boolean hasAttachments;
    private boolean read;

    @Data
    @Builder
    public static class CanonicalAttachment {
        private String filename;
        private long size;
        private String mimeType;
        private String providerAttachmentId;
    }
}
