package com.unifiedinbox.service;

import com.unifiedinbox.dto.CanonicalMessage;
import com.unifiedinbox.dto.DeltaResult;
import com.unifiedinbox.dto.FetchMode;
import com.unifiedinbox.dto.SyncResult;
import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.entity.GmailCursor;
import com.unifiedinbox.repository.AttachmentRepository;
import com.unifiedinbox.repository.EmailAccountRepository;
import com.unifiedinbox.repository.MailThreadRepository;
import com.unifiedinbox.repository.MessageRepository;
import com.unifiedinbox.repository.SyncLeaseRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Two accounts of the same user receive the same provider message. Only one
 * row may exist, and neither account's sync may fail because of it.
 */
@SpringBootTest
class CrossAccountDedupIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");

    @Autowired
    private MailSyncService mailSyncService;
    @Autowired
    private MailboxWriter mailboxWriter;
    @Autowired
    private TokenCipher tokenCipher;
    @Autowired
    private EmailAccountRepository accountRepository;
    @Autowired
    private MailThreadRepository threadRepository;
    @Autowired
    private AttachmentRepository attachmentRepository;
    @Autowired
    private SyncLeaseRepository leaseRepository;

    @SpyBean
    private MessageRepository messageRepository;
    @MockBean
    private MailProviderRegistry providers;

    private final GmailService parser = new GmailService(null, Clock.fixed(T0, ZoneOffset.UTC), "", "", "", 50);
    private GmailService gmail;
    private Long firstAccountId;
    private Long secondAccountId;

    @BeforeEach
    void setUp() {
        gmail = mock(GmailService.class);
        when(gmail.provider()).thenReturn(EmailAccount.EmailProvider.GMAIL);
        when(gmail.cursorType()).thenReturn(GmailCursor.class);
        when(gmail.parseRecord(any())).thenAnswer(invocation -> parser.parseRecord(invocation.getArgument(0)));
        doReturn(gmail).when(providers).forProvider(EmailAccount.EmailProvider.GMAIL);

        firstAccountId = account("ada@example.com", "access-a");
        secondAccountId = account("ada.work@example.com", "access-b");
    }

    @AfterEach
    void cleanUp() {
        attachmentRepository.deleteAll();
        messageRepository.deleteAll();
        threadRepository.deleteAll();
        leaseRepository.deleteAll();
        accountRepository.deleteAll();
    }

    private Long account(String address, String accessToken) {
        EmailAccount account = new EmailAccount();
        account.setUserId(1L);
        account.setEmailAddress(address);
        account.setProvider(EmailAccount.EmailProvider.GMAIL);
        account.setAccessToken(accessToken);
        account.setTokenExpiresAt(Instant.now().plus(1, ChronoUnit.HOURS));
        account.setEncryptedRefreshToken(tokenCipher.encrypt("refresh-" + address));
        return accountRepository.save(account).getId();
    }

    private static Map<String, Object> record(String id, String threadId) {
        return Map.of(
            "id", id,
            "threadId", threadId,
            "snippet", "snippet of " + id,
            "internalDate", String.valueOf(T0.toEpochMilli()),
            "payload", Map.of("headers", List.of(
                Map.of("name", "From", "value", "grace@example.com"),
                Map.of("name", "Subject", "value", "Thread " + threadId))));
    }

    private void givenFullFetch(String accessToken, List<Map<String, Object>> records) {
        when(gmail.fetchDelta(eq(accessToken), isNull()))
            .thenReturn(new DeltaResult<>(records, new GmailCursor("1000"), FetchMode.FULL));
    }

    @Test
    void messageStoredByOneAccountIsSkippedByTheOther() {
        givenFullFetch("access-a", List.of(record("shared", "t1")));
        givenFullFetch("access-b", List.of(record("shared", "t1"), record("own", "t2")));

        SyncResult first = mailSyncService.sync(firstAccountId);
        SyncResult second = mailSyncService.sync(secondAccountId);

        assertThat(first.getStatus()).isEqualTo(SyncResult.Status.SUCCESS);
        assertThat(second.getStatus()).isEqualTo(SyncResult.Status.SUCCESS);
        assertThat(second.getMessagesIngested()).isEqualTo(1);
        assertThat(messageRepository.countByProviderMessageIdIn(List.of("shared"))).isEqualTo(1);
        assertThat(messageRepository.countByAccountId(firstAccountId)).isEqualTo(1);
        assertThat(messageRepository.countByAccountId(secondAccountId)).isEqualTo(1);
    }

    @Test
    void insertRejectedByTheUniqueIndexIsReplayed() throws Exception {
        givenFullFetch("access-b", List.of(record("shared", "t1"), record("own", "t2")));
        CanonicalMessage shared = parser.parseRecord(record("shared", "t1"));

        // The first account commits "shared" right after the second account's existence check
        Answer<?> stored = mockingDetails(messageRepository).getMockCreationSettings().getDefaultAnswer();
        AtomicBoolean raced = new AtomicBoolean();
        doAnswer(invocation -> {
            Object existing = stored.answer(invocation);
            if (raced.compareAndSet(false, true)) {
                CompletableFuture.runAsync(() -> mailboxWriter.apply(firstAccountId, List.of(shared), null))
                    .get(5, TimeUnit.SECONDS);
            }
            return existing;
        }).when(messageRepository).findExistingProviderMessageIds(anyCollection());

        SyncResult result = mailSyncService.sync(secondAccountId);

        assertThat(result.getStatus()).isEqualTo(SyncResult.Status.SUCCESS);
        assertThat(result.getMessagesIngested()).isEqualTo(1);
        assertThat(raced).isTrue();
        assertThat(messageRepository.countByProviderMessageIdIn(List.of("shared"))).isEqualTo(1);
        assertThat(messageRepository.countByAccountId(firstAccountId)).isEqualTo(1);
        assertThat(messageRepository.countByAccountId(secondAccountId)).isEqualTo(1);
        assertThat(threadRepository.countByAccountId(secondAccountId)).isEqualTo(1);
        assertThat(accountRepository.findById(secondAccountId).orElseThrow().getSyncCursor())
            .isEqualTo(new GmailCursor("1000"));
    }
}
