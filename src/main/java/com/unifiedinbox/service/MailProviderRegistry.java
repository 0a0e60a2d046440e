package com.unifiedinbox.service;

import com.unifiedinbox.entity.EmailAccount;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class MailProviderRegistry {

    private final Map<EmailAccount.EmailProvider, MailProviderAdapter<?>> adapters =
        new EnumMap<>(EmailAccount.EmailProvider.class);

    public MailProviderRegistry(List<MailProviderAdapter<?>> adapters) {
        for (MailProviderAdapter<?> adapter : adapters) {
            this.adapters.put(adapter.provider(), adapter);
        }
    }

    public MailProviderAdapter<?> forProvider(EmailAccount.EmailProvider provider) {
        MailProviderAdapter<?> adapter = adapters.get(provider);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for " + provider);
        }
        return adapter;
    }
}
