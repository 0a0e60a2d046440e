package com.unifiedinbox.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutgoingDraft {
    private List<String> to;
    private List<String> cc;
    private String subject;
    private String bodyText;
    private String bodyHtml;
    // Provider message id being answered, if any
    private String inReplyTo;
    private String references;
    private String providerThreadId;
}
