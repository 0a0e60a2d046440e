package com.unifiedinbox.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProviderSendResult {
    private String status;
    // Null when the provider does not return the sent message (Graph sendMail)
    private String providerMessageId;
    private String providerThreadId;
}
