package com.unifiedinbox.service;

import com.unifiedinbox.dto.CanonicalMessage;
import com.unifiedinbox.entity.Attachment;
import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.entity.MailThread;
import com.unifiedinbox.entity.Message;
import com.unifiedinbox.entity.SyncCursor;
import com.unifiedinbox.exception.MailSyncException;
import com.unifiedinbox.repository.AttachmentRepository;
import com.unifiedinbox.repository.EmailAccountRepository;
import com.unifiedinbox.repository.MailThreadRepository;
import com.unifiedinbox.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes one fetched batch: threads, messages, attachments and the new
 * cursor commit together or not at all.
 */
@Service
@Slf4j
public class MailboxWriter {

    private final EmailAccountRepository accountRepository;
    private final MailThreadRepository threadRepository;
    private final MessageRepository messageRepository;
    private final AttachmentRepository attachmentRepository;
    private final Clock clock;

    public MailboxWriter(EmailAccountRepository accountRepository,
                         MailThreadRepository threadRepository,
                         MessageRepository messageRepository,
                         AttachmentRepository attachmentRepository,
                         Clock clock) {
        this.accountRepository = accountRepository;
        this.threadRepository = threadRepository;
        this.messageRepository = messageRepository;
        this.attachmentRepository = attachmentRepository;
        this.clock = clock;
    }

    /**
     * @param nextCursor cursor to store; {@code null} keeps the current one
     * @return number of messages inserted, excluding ones already stored
     */
    @Transactional
    public int apply(Long accountId, List<CanonicalMessage> messages, SyncCursor nextCursor) {
        EmailAccount account = accountRepository.findById(accountId)
            .orElseThrow(() -> new MailSyncException("Account " + accountId + " was removed during sync"));

        // Batch check for ids already stored by any account
        Set<String> seen = new HashSet<>();
        if (!messages.isEmpty()) {
            List<String> ids = messages.stream()
                .map(CanonicalMessage::getProviderMessageId)
                .collect(Collectors.toList());
            seen.addAll(messageRepository.findExistingProviderMessageIds(ids));
        }

        Map<String, MailThread> threads = new HashMap<>();
        int ingested = 0;
        int skipped = 0;

        for (CanonicalMessage canonical : messages) {
            if (!fitsKeyColumns(canonical)) {
                log.warn("Skipping message of account {} with an identifier longer than its column", accountId);
                skipped++;
                continue;
            }
            // add() is false for stored ids and for repeats inside this batch
            if (!seen.add(canonical.getProviderMessageId())) {
                skipped++;
                continue;
            }

            MailThread thread = upsertThread(accountId, canonical, threads);
            Message message = messageRepository.save(toMessage(thread.getId(), canonical));

            for (CanonicalMessage.CanonicalAttachment att : canonical.getAttachments()) {
                String providerAttachmentId = att.getProviderAttachmentId() != null ? att.getProviderAttachmentId() : "";
                if (providerAttachmentId.length() > Attachment.PROVIDER_ATTACHMENT_ID_LENGTH) {
                    log.warn("Skipping attachment of message {}: provider id too long", canonical.getProviderMessageId());
                    continue;
                }
                Attachment attachment = new Attachment();
                attachment.setMessageId(message.getId());
                attachment.setFilename(clip(att.getFilename() != null ? att.getFilename() : "", Attachment.FILENAME_LENGTH));
                attachment.setSize(att.getSize());
                attachment.setMimeType(clip(att.getMimeType(), Attachment.MIME_TYPE_LENGTH));
                attachment.setProviderAttachmentId(providerAttachmentId);
                attachmentRepository.save(attachment);
            }
            ingested++;
        }

        if (nextCursor != null) {
            account.setSyncCursor(nextCursor);
        }
        account.setLastSyncedAt(clock.instant());
        account.setLastSyncError(null);
        accountRepository.save(account);

        log.debug("Account {}: {} messages ingested, {} already stored", accountId, ingested, skipped);
        return ingested;
    }

    /**
     * Find-or-create by (account, provider thread id). {@code lastMessageAt} only
     * moves forward, and the snippet follows the newest message.
     */
    private MailThread upsertThread(Long accountId, CanonicalMessage canonical, Map<String, MailThread> cache) {
        String providerThreadId = canonical.getProviderThreadId();
        MailThread thread = cache.get(providerThreadId);
        if (thread == null) {
            thread = threadRepository.findByAccountIdAndProviderThreadId(accountId, providerThreadId).orElse(null);
        }

        Instant date = canonical.getDate();
        if (thread == null) {
            thread = new MailThread();
            thread.setAccountId(accountId);
            thread.setProviderThreadId(providerThreadId);
            thread.setSubject(canonical.getSubject());
            thread.setSnippet(canonical.getSnippet());
            thread.setLastMessageAt(date);
            thread = threadRepository.save(thread);
        } else if (date != null && (thread.getLastMessageAt() == null || date.isAfter(thread.getLastMessageAt()))) {
            thread.setLastMessageAt(date);
            thread.setSnippet(canonical.getSnippet());
            thread = threadRepository.save(thread);
        }

        cache.put(providerThreadId, thread);
        return thread;
    }

    private Message toMessage(Long threadId, CanonicalMessage canonical) {
        Message message = new Message();
        message.setThreadId(threadId);
        message.setProviderMessageId(canonical.getProviderMessageId());
        message.setFromAddress(clip(canonical.getFrom() != null ? canonical.getFrom() : "", Message.FROM_ADDRESS_LENGTH));
        message.setToAddresses(new ArrayList<>(canonical.getTo()));
        message.setCcAddresses(new ArrayList<>(canonical.getCc()));
        message.setBccAddresses(new ArrayList<>(canonical.getBcc()));
        message.setSubject(canonical.getSubject());
        message.setSentAt(canonical.getDate());
        message.setBodyText(canonical.getBodyText());
        message.setBodyHtml(canonical.getBodyHtml());
        message.setHasAttachments(canonical.isHasAttachments());
        message.setRead(canonical.isRead());
        return message;
    }

    // Identifiers cannot be shortened without breaking deduplication
    private static boolean fitsKeyColumns(CanonicalMessage canonical) {
        return canonical.getProviderMessageId().length() <= Message.PROVIDER_MESSAGE_ID_LENGTH
            && canonical.getProviderThreadId().length() <= MailThread.PROVIDER_THREAD_ID_LENGTH;
    }

    private static String clip(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
