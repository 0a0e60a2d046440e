package com.unifiedinbox.service;

import com.unifiedinbox.dto.CanonicalMessage;
import com.unifiedinbox.dto.DeltaResult;
import com.unifiedinbox.dto.FetchMode;
import com.unifiedinbox.dto.OutgoingDraft;
import com.unifiedinbox.dto.ProviderCredential;
import com.unifiedinbox.dto.ProviderProfile;
import com.unifiedinbox.dto.ProviderSendResult;
import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.entity.OutlookCursor;
import com.unifiedinbox.exception.AuthExchangeException;
import com.unifiedinbox.exception.MailSyncException;
import com.unifiedinbox.exception.MalformedRecordException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

import static com.unifiedinbox.service.RawRecords.map;
import static com.unifiedinbox.service.RawRecords.mapList;
import static com.unifiedinbox.service.RawRecords.number;
import static com.unifiedinbox.service.RawRecords.str;

@Service
@Slf4j
public class OutlookService implements MailProviderAdapter<OutlookCursor> {

    static final String GRAPH_API_BASE = "https://graph.microsoft.com/v1.0/me";
    static final String INBOX_DELTA_URL = GRAPH_API_BASE + "/mailFolders/Inbox/messages/delta" +
        "?$select=id,conversationId,subject,from,toRecipients,ccRecipients,bccRecipients," +
        "receivedDateTime,sentDateTime,bodyPreview,body,isRead,hasAttachments";
    private static final String LOGIN_BASE = "https://login.microsoftonline.com/";
    private static final String SCOPES = "offline_access User.Read Mail.Read Mail.Send";
    private static final int PAGE_SIZE = 50;

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final String microsoftClientId;
    private final String microsoftClientSecret;
    private final String microsoftRedirectUri;
    private final String tenant;
    private final int maxMessagesPerSync;

    public OutlookService(RestTemplate restTemplate,
                          Clock clock,
                          @Value("${oauth.microsoft.client-id:}") String microsoftClientId,
                          @Value("${oauth.microsoft.client-secret:}") String microsoftClientSecret,
                          @Value("${oauth.microsoft.redirect-uri:}") String microsoftRedirectUri,
                          @Value("${oauth.microsoft.tenant:common}") String tenant,
                          @Value("${sync.max-messages-per-account:50}") int maxMessagesPerSync) {
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.microsoftClientId = microsoftClientId;
        this.microsoftClientSecret = microsoftClientSecret;
        this.microsoftRedirectUri = microsoftRedirectUri;
        this.tenant = tenant;
        this.maxMessagesPerSync = maxMessagesPerSync;
    }

    @Override
    public EmailAccount.EmailProvider provider() {
        return EmailAccount.EmailProvider.OUTLOOK;
    }

    @Override
    public Class<OutlookCursor> cursorType() {
        return OutlookCursor.class;
    }

    @Override
    public String authorizeUrl(String state) {
        return LOGIN_BASE + tenant + "/oauth2/v2.0/authorize?" +
            "client_id=" + encode(microsoftClientId) +
            "&redirect_uri=" + encode(microsoftRedirectUri) +
            "&response_type=code" +
            "&response_mode=query" +
            "&scope=" + encode(SCOPES) +
            "&prompt=select_account" +
            "&state=" + encode(state);
    }

    @Override
    public ProviderCredential exchangeCode(String code) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", microsoftClientId);
        body.add("client_secret", microsoftClientSecret);
        body.add("code", code);
        body.add("redirect_uri", microsoftRedirectUri);
        body.add("grant_type", "authorization_code");
        body.add("scope", SCOPES);

        try {
            ProviderCredential credential = postTokenRequest(body);
            if (credential == null || credential.getAccessToken() == null) {
                throw new AuthExchangeException("Microsoft token exchange returned no access_token", null);
            }
            return credential;
        } catch (RestClientException e) {
            log.error("Microsoft code exchange failed: {}", e.getMessage());
            throw new AuthExchangeException("Microsoft code exchange failed: " + e.getMessage(), e);
        }
    }

    /**
     * Refresh access token using refresh token. Microsoft usually returns a new
     * refresh token, which the caller must store in place of the old one.
     */
    @Override
    public ProviderCredential refreshCredential(String refreshToken) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", microsoftClientId);
        body.add("client_secret", microsoftClientSecret);
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");
        body.add("scope", SCOPES);

        try {
            ProviderCredential credential = postTokenRequest(body);
            if (credential == null || credential.getAccessToken() == null) {
                throw new MailSyncException("Microsoft refresh returned no access_token");
            }
            return credential;
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translateRefresh("Microsoft", e);
        }
    }

    @Override
    public ProviderProfile getProfile(String accessToken) {
        try {
            Map<String, Object> userInfo = getJson(URI.create(GRAPH_API_BASE), accessToken);
            // For personal accounts, 'mail' might be null, use userPrincipalName as fallback
            String email = str(userInfo.get("mail"));
            if (email.isEmpty()) {
                email = str(userInfo.get("userPrincipalName"));
            }
            return new ProviderProfile(email, str(userInfo.get("displayName")));
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate("Graph profile", e);
        }
    }

    @Override
    public DeltaResult<OutlookCursor> fetchDelta(String accessToken, OutlookCursor cursor) {
        try {
            if (cursor != null && cursor.getDeltaLink() != null && !cursor.getDeltaLink().isEmpty()) {
                try {
                    return followDelta(accessToken, cursor.getDeltaLink(), FetchMode.INCREMENTAL);
                } catch (HttpClientErrorException e) {
                    if (!isStaleDelta(e)) {
                        throw e;
                    }
                    log.info("Graph delta token rejected ({}), falling back to full sync", e.getStatusCode().value());
                }
            }
            return followDelta(accessToken, INBOX_DELTA_URL, FetchMode.FULL);
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate("Graph delta fetch", e);
        }
    }

    /**
     * Follows {@code @odata.nextLink} until Graph hands out a deltaLink. If the
     * per-sync message cap is reached first, the pending nextLink becomes the
     * cursor and the next sync resumes from it.
     */
    private DeltaResult<OutlookCursor> followDelta(String accessToken, String startUrl, FetchMode mode) {
        List<Map<String, Object>> records = new ArrayList<>();
        String url = startUrl;
        String resumeLink = null;

        while (url != null) {
            Map<String, Object> page = getDeltaPage(URI.create(url), accessToken);

            for (Map<String, Object> msg : mapList(page.get("value"))) {
                if (msg.containsKey("@removed")) {
                    continue;
                }
                Map<String, Object> record = withAttachments(accessToken, msg);
                if (record != null) {
                    records.add(record);
                }
            }

            String nextLink = (String) page.get("@odata.nextLink");
            String deltaLink = (String) page.get("@odata.deltaLink");
            if (deltaLink != null) {
                resumeLink = deltaLink;
                url = null;
            } else if (nextLink != null && records.size() >= maxMessagesPerSync) {
                resumeLink = nextLink;
                url = null;
            } else {
                url = nextLink;
            }
        }

        log.debug("Graph {} delta: {} messages", mode, records.size());
        return new DeltaResult<>(records, resumeLink != null ? new OutlookCursor(resumeLink) : null, mode);
    }

    private boolean isStaleDelta(HttpClientErrorException e) {
        int status = e.getStatusCode().value();
        if (status == 410) {
            return true;
        }
        String body = e.getResponseBodyAsString();
        return (status == 400 || status == 404) &&
            (body.contains("syncStateNotFound") || body.contains("resyncRequired") || body.contains("SyncStateInvalid"));
    }

    /**
     * Delta pages carry no attachment metadata, so it is read separately.
     * Returns null when the message was deleted after the delta page was read.
     */
    private Map<String, Object> withAttachments(String accessToken, Map<String, Object> msg) {
        if (!Boolean.TRUE.equals(msg.get("hasAttachments"))) {
            return msg;
        }
        String url = GRAPH_API_BASE + "/messages/" + encode(str(msg.get("id"))) +
            "/attachments?$select=id,name,contentType,size";
        Map<String, Object> response;
        try {
            response = getJson(URI.create(url), accessToken);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Graph message {} disappeared before its attachments could be read", msg.get("id"));
            return null;
        }

        Map<String, Object> enriched = new HashMap<>(msg);
        enriched.put("attachments", mapList(response.get("value")));
        return enriched;
    }

    @Override
    public CanonicalMessage parseRecord(Map<String, Object> raw) {
        String messageId = str(raw.get("id"));
        if (messageId.isEmpty()) {
            throw new MalformedRecordException("Graph record without id");
        }

        Map<String, Object> body = map(raw.get("body"));
        String content = str(body.get("content"));
        boolean html = "html".equalsIgnoreCase(str(body.get("contentType")));

        List<CanonicalMessage.CanonicalAttachment> attachments = new ArrayList<>();
        for (Map<String, Object> att : mapList(raw.get("attachments"))) {
            attachments.add(CanonicalMessage.CanonicalAttachment.builder()
                .filename(str(att.get("name")))
                .mimeType(str(att.get("contentType")))
                .size(number(att.get("size")))
                .providerAttachmentId(str(att.get("id")))
                .build());
        }

        String conversationId = str(raw.get("conversationId"));
        String received = str(raw.get("receivedDateTime"));

        return CanonicalMessage.builder()
            .providerMessageId(messageId)
            .providerThreadId(conversationId.isEmpty() ? messageId : conversationId)
            .from(formatSender(map(map(raw.get("from")).get("emailAddress"))))
            .to(recipients(raw.get("toRecipients")))
            .cc(recipients(raw.get("ccRecipients")))
            .bcc(recipients(raw.get("bccRecipients")))
            .subject(str(raw.get("subject")))
            .date(parseDate(received.isEmpty() ? str(raw.get("sentDateTime")) : received))
            .bodyText(html ? "" : content)
            .bodyHtml(html ? content : "")
            .snippet(str(raw.get("bodyPreview")))
            .attachments(attachments)
            .hasAttachments(Boolean.TRUE.equals(raw.get("hasAttachments")) || !attachments.isEmpty())
            .read(Boolean.TRUE.equals(raw.get("isRead")))
            .build();
    }

    private String formatSender(Map<String, Object> emailAddress) {
        String address = str(emailAddress.get("address"));
        String name = str(emailAddress.get("name"));
        if (name.isEmpty() || name.equalsIgnoreCase(address)) {
            return address;
        }
        return name + " <" + address + ">";
    }

    private List<String> recipients(Object value) {
        List<String> addresses = new ArrayList<>();
        for (Map<String, Object> recipient : mapList(value)) {
            String address = str(map(recipient.get("emailAddress")).get("address"));
            if (!address.isEmpty()) {
                addresses.add(address);
            }
        }
        return addresses;
    }

    private Instant parseDate(String value) {
        if (!value.isEmpty()) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Unparsable Graph date '{}'", value);
            }
        }
        return clock.instant();
    }

    /**
     * Replies go through {@code /messages/{id}/reply} so Graph threads them;
     * everything else through {@code /sendMail}.
     */
    @Override
    public ProviderSendResult sendMessage(String accessToken, OutgoingDraft draft) {
        boolean html = draft.getBodyHtml() != null;
        String content = html ? draft.getBodyHtml() : (draft.getBodyText() != null ? draft.getBodyText() : "");

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            if (draft.getInReplyTo() != null) {
                restTemplate.exchange(
                    URI.create(GRAPH_API_BASE + "/messages/" + encode(draft.getInReplyTo()) + "/reply"),
                    HttpMethod.POST,
                    new HttpEntity<>(Map.of("comment", content), headers),
                    Void.class
                );
            } else {
                Map<String, Object> message = new HashMap<>();
                message.put("subject", draft.getSubject() != null ? draft.getSubject() : "");
                message.put("body", Map.of("contentType", html ? "HTML" : "Text", "content", content));
                message.put("toRecipients", toRecipients(draft.getTo()));
                message.put("ccRecipients", toRecipients(draft.getCc()));

                restTemplate.exchange(
                    URI.create(GRAPH_API_BASE + "/sendMail"),
                    HttpMethod.POST,
                    new HttpEntity<>(Map.of("message", message, "saveToSentItems", true), headers),
                    Void.class
                );
            }
            return new ProviderSendResult("sent", null, null);
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate("Graph send", e);
        }
    }

    private List<Map<String, Object>> toRecipients(List<String> addresses) {
        List<Map<String, Object>> recipients = new ArrayList<>();
        if (addresses != null) {
            for (String address : addresses) {
                recipients.add(Map.of("emailAddress", Map.of("address", address)));
            }
        }
        return recipients;
    }

    private ProviderCredential postTokenRequest(MultiValueMap<String, String> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        return restTemplate.postForObject(
            LOGIN_BASE + tenant + "/oauth2/v2.0/token",
            new HttpEntity<>(body, headers),
            ProviderCredential.class
        );
    }

    private Map<String, Object> getDeltaPage(URI url, String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.set("Prefer", "odata.maxpagesize=" + PAGE_SIZE);
        return exchangeForMap(url, headers);
    }

    private Map<String, Object> getJson(URI url, String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        return exchangeForMap(url, headers);
    }

    private Map<String, Object> exchangeForMap(URI url, HttpHeaders headers) {
        @SuppressWarnings("unchecked")
        Map<String, Object> body = restTemplate.exchange(
            url,
            HttpMethod.GET,
            new HttpEntity<>(headers),
            Map.class
        ).getBody();
        return body != null ? body : Map.of();
    }

    private String encode(String value) {
        return URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8);
    }
}
