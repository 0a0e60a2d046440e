package com.unifiedinbox.service;

import com.unifiedinbox.dto.CanonicalMessage;
import com.unifiedinbox.dto.DeltaResult;
import com.unifiedinbox.dto.FetchMode;
import com.unifiedinbox.dto.OutgoingDraft;
import com.unifiedinbox.entity.GmailCursor;
import com.unifiedinbox.exception.AuthExpiredException;
import com.unifiedinbox.exception.CredentialRejectedException;
import com.unifiedinbox.exception.MalformedRecordException;
import com.unifiedinbox.exception.PermanentProviderException;
import com.unifiedinbox.exception.TransientProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class GmailServiceTest {

    private static final String BASE = GmailService.GMAIL_API_BASE;
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private MockRestServiceServer server;
    private GmailService gmail;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gmail = new GmailService(restTemplate, Clock.fixed(NOW, ZoneOffset.UTC),
            "client-id", "client-secret", "http://localhost/callback", 50);
    }

    @Test
    void fullFetchReadsHistoryIdBeforeListing() {
        server.expect(requestTo(BASE + "/profile"))
            .andExpect(header("Authorization", "Bearer token"))
            .andRespond(withSuccess("{\"emailAddress\":\"ada@example.com\",\"historyId\":\"1000\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages?maxResults=50&labelIds=INBOX"))
            .andRespond(withSuccess("{\"messages\":[{\"id\":\"m1\"},{\"id\":\"m2\"}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m1?format=full"))
            .andRespond(withSuccess("{\"id\":\"m1\",\"threadId\":\"t1\"}", MediaType.APPLICATION_JSON));
        // Deleted between list and get
        server.expect(requestTo(BASE + "/messages/m2?format=full"))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));

        DeltaResult<GmailCursor> delta = gmail.fetchDelta("token", null);

        server.verify();
        assertThat(delta.getMode()).isEqualTo(FetchMode.FULL);
        assertThat(delta.getNextCursor()).isEqualTo(new GmailCursor("1000"));
        assertThat(delta.getRecords()).extracting(r -> r.get("id")).containsExactly("m1");
    }

    @Test
    void incrementalFetchFollowsHistoryPages() {
        server.expect(requestTo(BASE + "/history?startHistoryId=1000&historyTypes=messageAdded&labelId=INBOX"))
            .andRespond(withSuccess("{\"historyId\":\"1010\",\"nextPageToken\":\"p2\",\"history\":[" +
                "{\"messagesAdded\":[{\"message\":{\"id\":\"m3\"}}]}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/history?startHistoryId=1000&historyTypes=messageAdded&labelId=INBOX&pageToken=p2"))
            .andRespond(withSuccess("{\"historyId\":\"1012\",\"history\":[" +
                "{\"messagesAdded\":[{\"message\":{\"id\":\"m3\"}},{\"message\":{\"id\":\"m4\"}}]}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m3?format=full"))
            .andRespond(withSuccess("{\"id\":\"m3\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages/m4?format=full"))
            .andRespond(withSuccess("{\"id\":\"m4\"}", MediaType.APPLICATION_JSON));

        DeltaResult<GmailCursor> delta = gmail.fetchDelta("token", new GmailCursor("1000"));

        server.verify();
        assertThat(delta.getMode()).isEqualTo(FetchMode.INCREMENTAL);
        assertThat(delta.getNextCursor().getHistoryId()).isEqualTo("1012");
        assertThat(delta.getRecords()).hasSize(2);
    }

    @Test
    void staleHistoryIdFallsBackToFullFetch() {
        server.expect(requestTo(BASE + "/history?startHistoryId=5&historyTypes=messageAdded&labelId=INBOX"))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(BASE + "/profile"))
            .andRespond(withSuccess("{\"historyId\":\"2000\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/messages?maxResults=50&labelIds=INBOX"))
            .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        DeltaResult<GmailCursor> delta = gmail.fetchDelta("token", new GmailCursor("5"));

        server.verify();
        assertThat(delta.getMode()).isEqualTo(FetchMode.FULL);
        assertThat(delta.getNextCursor().getHistoryId()).isEqualTo("2000");
        assertThat(delta.getRecords()).isEmpty();
    }

    @Test
    void mapsHttpFailuresToErrorKinds() {
        server.expect(requestTo(BASE + "/profile")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        assertThatThrownBy(() -> gmail.fetchDelta("token", null)).isInstanceOf(CredentialRejectedException.class);

        server.reset();
        server.expect(requestTo(BASE + "/profile")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        assertThatThrownBy(() -> gmail.fetchDelta("token", null)).isInstanceOf(TransientProviderException.class);

        server.reset();
        server.expect(requestTo(BASE + "/profile")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        assertThatThrownBy(() -> gmail.fetchDelta("token", null)).isInstanceOf(TransientProviderException.class);

        server.reset();
        server.expect(requestTo(BASE + "/profile")).andRespond(withStatus(HttpStatus.FORBIDDEN));
        assertThatThrownBy(() -> gmail.fetchDelta("token", null)).isInstanceOf(PermanentProviderException.class);
    }

    @Test
    void invalidGrantOnRefreshMeansAuthorizationExpired() {
        server.expect(requestTo(GmailService.TOKEN_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().formDataContains(Map.of("grant_type", "refresh_token", "refresh_token", "r-1")))
            .andRespond(withBadRequest().body("{\"error\":\"invalid_grant\"}").contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gmail.refreshCredential("r-1")).isInstanceOf(AuthExpiredException.class);
    }

    @Test
    void refreshReturnsNewAccessToken() {
        server.expect(requestTo(GmailService.TOKEN_URL))
            .andRespond(withSuccess("{\"access_token\":\"a-2\",\"expires_in\":3599,\"token_type\":\"Bearer\"}",
                MediaType.APPLICATION_JSON));

        var credential = gmail.refreshCredential("r-1");

        assertThat(credential.getAccessToken()).isEqualTo("a-2");
        assertThat(credential.getExpiresIn()).isEqualTo(3599);
        assertThat(credential.getRefreshToken()).isNull();
    }

    @Test
    void parsesMultipartMessage() {
        Map<String, Object> raw = Map.of(
            "id", "m1",
            "threadId", "t1",
            "snippet", "Hello Ada",
            "labelIds", List.of("INBOX", "UNREAD"),
            "payload", Map.of(
                "mimeType", "multipart/mixed",
                "headers", List.of(
                    Map.of("name", "From", "value", "Grace Hopper <grace@example.com>"),
                    Map.of("name", "to", "value", "Ada <ada@example.com>, bob@example.com"),
                    Map.of("name", "Subject", "value", "Compilers"),
                    Map.of("name", "Date", "value", "Wed, 1 May 2024 09:30:00 +0000")),
                "parts", List.of(
                    Map.of("mimeType", "multipart/alternative", "parts", List.of(
                        Map.of("mimeType", "text/plain", "body", Map.of("data", "SGVsbG8gQWRh")),
                        Map.of("mimeType", "text/html", "body", Map.of("data", "PHA-SGVsbG8gQWRhPC9wPg==")))),
                    Map.of("mimeType", "application/pdf", "filename", "notes.pdf",
                        "body", Map.of("attachmentId", "att-1", "size", 2048)))));

        CanonicalMessage message = gmail.parseRecord(raw);

        assertThat(message.getProviderMessageId()).isEqualTo("m1");
        assertThat(message.getProviderThreadId()).isEqualTo("t1");
        assertThat(message.getFrom()).isEqualTo("Grace Hopper <grace@example.com>");
        assertThat(message.getTo()).containsExactly("ada@example.com", "bob@example.com");
        assertThat(message.getSubject()).isEqualTo("Compilers");
        assertThat(message.getDate()).isEqualTo(Instant.parse("2024-05-01T09:30:00Z"));
        assertThat(message.getBodyText()).isEqualTo("Hello Ada");
        assertThat(message.getBodyHtml()).isEqualTo("<p>Hello Ada</p>");
        assertThat(message.isRead()).isFalse();
        assertThat(message.isHasAttachments()).isTrue();
        assertThat(message.getAttachments()).singleElement().satisfies(att -> {
            assertThat(att.getFilename()).isEqualTo("notes.pdf");
            assertThat(att.getSize()).isEqualTo(2048L);
            assertThat(att.getProviderAttachmentId()).isEqualTo("att-1");
        });
    }

    @Test
    void toleratesMissingOptionalFieldsAndBadDates() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", "m9");
        raw.put("internalDate", "1714555800000");
        raw.put("payload", Map.of("headers", List.of(Map.of("name", "Date", "value", "not a date"))));

        CanonicalMessage message = gmail.parseRecord(raw);

        assertThat(message.getProviderThreadId()).isEqualTo("m9");
        assertThat(message.getFrom()).isEmpty();
        assertThat(message.getTo()).isEmpty();
        assertThat(message.getDate()).isEqualTo(Instant.ofEpochMilli(1714555800000L));
        assertThat(message.isRead()).isTrue();

        CanonicalMessage bare = gmail.parseRecord(Map.of("id", "m10"));
        assertThat(bare.getDate()).isEqualTo(NOW);
    }

    @Test
    void sendsRawMimeMessageInThread() {
        server.expect(requestTo(BASE + "/messages/send"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.raw").isNotEmpty())
            .andExpect(jsonPath("$.threadId").value("t1"))
            .andRespond(withSuccess("{\"id\":\"m7\",\"threadId\":\"t1\"}", MediaType.APPLICATION_JSON));

        var result = gmail.sendMessage("token", OutgoingDraft.builder()
            .to(List.of("grace@example.com"))
            .subject("Re: Compilers")
            .bodyText("Agreed")
            .inReplyTo("<abc@mail.gmail.com>")
            .providerThreadId("t1")
            .build());

        server.verify();
        assertThat(result.getProviderMessageId()).isEqualTo("m7");
        assertThat(result.getProviderThreadId()).isEqualTo("t1");
    }

    @Test
    void rejectsRecordWithoutId() {
        assertThatThrownBy(() -> gmail.parseRecord(Map.of("threadId", "t1")))
            .isInstanceOf(MalformedRecordException.class);
    }
}
