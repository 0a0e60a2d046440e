package com.unifiedinbox.service;

import com.unifiedinbox.dto.CanonicalMessage;
import com.unifiedinbox.dto.DeltaResult;
import com.unifiedinbox.dto.FetchMode;
import com.unifiedinbox.dto.OutgoingDraft;
import com.unifiedinbox.dto.ProviderCredential;
import com.unifiedinbox.dto.ProviderProfile;
import com.unifiedinbox.dto.ProviderSendResult;
import com.unifiedinbox.entity.EmailAccount;
import com.unifiedinbox.entity.GmailCursor;
import com.unifiedinbox.exception.AuthExchangeException;
import com.unifiedinbox.exception.MailSyncException;
import com.unifiedinbox.exception.MalformedRecordException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MailDateFormat;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

import static com.unifiedinbox.service.RawRecords.map;
import static com.unifiedinbox.service.RawRecords.mapList;
import static com.unifiedinbox.service.RawRecords.number;
import static com.unifiedinbox.service.RawRecords.str;
import static com.unifiedinbox.service.RawRecords.stringList;

@Service
@Slf4j
public class GmailService implements MailProviderAdapter<GmailCursor> {

    static final String GMAIL_API_BASE = "https://gmail.googleapis.com/gmail/v1/users/me";
    static final String TOKEN_URL = "https://oauth2.googleapis.com/token";
    private static final String AUTHORIZE_URL = "https://accounts.google.com/o/oauth2/v2/auth";
    private static final String SCOPES =
        "https://www.googleapis.com/auth/gmail.readonly https://www.googleapis.com/auth/gmail.send";
    private static final int LIST_PAGE_SIZE = 100;

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final String googleClientId;
    private final String googleClientSecret;
    private final String googleRedirectUri;
    private final int maxMessagesPerSync;

    public GmailService(RestTemplate restTemplate,
                        Clock clock,
                        @Value("${oauth.google.client-id:}") String googleClientId,
                        @Value("${oauth.google.client-secret:}") String googleClientSecret,
                        @Value("${oauth.google.redirect-uri:}") String googleRedirectUri,
                        @Value("${sync.max-messages-per-account:50}") int maxMessagesPerSync) {
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.googleClientId = googleClientId;
        this.googleClientSecret = googleClientSecret;
        this.googleRedirectUri = googleRedirectUri;
        this.maxMessagesPerSync = maxMessagesPerSync;
    }

    @Override
    public EmailAccount.EmailProvider provider() {
        return EmailAccount.EmailProvider.GMAIL;
    }

    @Override
    public Class<GmailCursor> cursorType() {
        return GmailCursor.class;
    }

    @Override
    public String authorizeUrl(String state) {
        return AUTHORIZE_URL + "?" +
            "client_id=" + encode(googleClientId) +
            "&redirect_uri=" + encode(googleRedirectUri) +
            "&response_type=code" +
            "&scope=" + encode(SCOPES) +
            "&access_type=offline" +
            "&prompt=consent" +
            "&state=" + encode(state);
    }

    @Override
    public ProviderCredential exchangeCode(String code) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("code", code);
        body.add("client_id", googleClientId);
        body.add("client_secret", googleClientSecret);
        body.add("redirect_uri", googleRedirectUri);
        body.add("grant_type", "authorization_code");

        try {
            ProviderCredential credential = postTokenRequest(body);
            if (credential == null || credential.getAccessToken() == null) {
                throw new AuthExchangeException("Google token exchange returned no access_token", null);
            }
            return credential;
        } catch (RestClientException e) {
            log.error("Google code exchange failed: {}", e.getMessage());
            throw new AuthExchangeException("Google code exchange failed: " + e.getMessage(), e);
        }
    }

    /**
     * Refresh access token using refresh token. Google does not rotate refresh tokens,
     * so the result normally carries none.
     */
    @Override
    public ProviderCredential refreshCredential(String refreshToken) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", googleClientId);
        body.add("client_secret", googleClientSecret);
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");

        try {
            ProviderCredential credential = postTokenRequest(body);
            if (credential == null || credential.getAccessToken() == null) {
                throw new MailSyncException("Google refresh returned no access_token");
            }
            return credential;
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translateRefresh("Google", e);
        }
    }

    @Override
    public ProviderProfile getProfile(String accessToken) {
        try {
            Map<String, Object> profile = getJson(GMAIL_API_BASE + "/profile", accessToken);
            String email = str(profile.get("emailAddress"));
            return new ProviderProfile(email, email);
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate("Gmail profile", e);
        }
    }

    @Override
    public DeltaResult<GmailCursor> fetchDelta(String accessToken, GmailCursor cursor) {
        try {
            if (cursor != null && cursor.getHistoryId() != null && !cursor.getHistoryId().isEmpty()) {
                DeltaResult<GmailCursor> incremental = fetchHistory(accessToken, cursor.getHistoryId());
                if (incremental != null) {
                    return incremental;
                }
                log.info("Gmail history {} is no longer available, falling back to full sync", cursor.getHistoryId());
            }
            return fetchFull(accessToken);
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate("Gmail fetch", e);
        }
    }

    /**
     * Recent INBOX messages. The historyId is read before listing so that mail
     * arriving during the listing shows up again in the next delta.
     */
    private DeltaResult<GmailCursor> fetchFull(String accessToken) {
        String historyId = str(getJson(GMAIL_API_BASE + "/profile", accessToken).get("historyId"));

        List<String> messageIds = new ArrayList<>();
        String pageToken = null;
        while (messageIds.size() < maxMessagesPerSync) {
            int pageSize = Math.min(LIST_PAGE_SIZE, maxMessagesPerSync - messageIds.size());
            String listUrl = GMAIL_API_BASE + "/messages?maxResults=" + pageSize + "&labelIds=INBOX";
            if (pageToken != null) {
                listUrl += "&pageToken=" + pageToken;
            }

            Map<String, Object> listResponse = getJson(listUrl, accessToken);
            for (Map<String, Object> ref : mapList(listResponse.get("messages"))) {
                messageIds.add(str(ref.get("id")));
            }

            pageToken = (String) listResponse.get("nextPageToken");
            if (pageToken == null) {
                break;
            }
        }

        List<Map<String, Object>> records = fetchMessages(accessToken, messageIds);
        log.debug("Gmail full fetch: {} messages, historyId {}", records.size(), historyId);
        return new DeltaResult<>(records, new GmailCursor(historyId), FetchMode.FULL);
    }

    /**
     * @return {@code null} when Gmail no longer keeps history that far back
     */
    private DeltaResult<GmailCursor> fetchHistory(String accessToken, String startHistoryId) {
        Set<String> addedIds = new LinkedHashSet<>();
        String latestHistoryId = startHistoryId;
        String pageToken = null;

        do {
            String url = GMAIL_API_BASE + "/history?startHistoryId=" + startHistoryId +
                "&historyTypes=messageAdded&labelId=INBOX";
            if (pageToken != null) {
                url += "&pageToken=" + pageToken;
            }

            Map<String, Object> response;
            try {
                response = getJson(url, accessToken);
            } catch (HttpClientErrorException e) {
                if (isStaleHistory(e)) {
                    return null;
                }
                throw e;
            }

            if (response.get("historyId") != null) {
                latestHistoryId = str(response.get("historyId"));
            }
            for (Map<String, Object> history : mapList(response.get("history"))) {
                for (Map<String, Object> added : mapList(history.get("messagesAdded"))) {
                    String id = str(map(added.get("message")).get("id"));
                    if (!id.isEmpty()) {
                        addedIds.add(id);
                    }
                }
            }
            pageToken = (String) response.get("nextPageToken");
        } while (pageToken != null);

        List<Map<String, Object>> records = fetchMessages(accessToken, new ArrayList<>(addedIds));
        log.debug("Gmail history since {}: {} new messages, now at {}", startHistoryId, records.size(), latestHistoryId);
        return new DeltaResult<>(records, new GmailCursor(latestHistoryId), FetchMode.INCREMENTAL);
    }

    private boolean isStaleHistory(HttpClientErrorException e) {
        int status = e.getStatusCode().value();
        return status == 404 || (status == 400 && e.getResponseBodyAsString().contains("istoryId"));
    }

    private List<Map<String, Object>> fetchMessages(String accessToken, List<String> messageIds) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (String messageId : messageIds) {
            try {
                records.add(getJson(GMAIL_API_BASE + "/messages/" + messageId + "?format=full", accessToken));
            } catch (HttpClientErrorException.NotFound e) {
                // Deleted between listing and reading
                log.debug("Gmail message {} disappeared before it could be read", messageId);
            }
        }
        return records;
    }

    @Override
    public CanonicalMessage parseRecord(Map<String, Object> raw) {
        String messageId = str(raw.get("id"));
        if (messageId.isEmpty()) {
            throw new MalformedRecordException("Gmail record without id");
        }

        Map<String, Object> payload = map(raw.get("payload"));
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map<String, Object> header : mapList(payload.get("headers"))) {
            headers.putIfAbsent(str(header.get("name")), str(header.get("value")));
        }

        BodyParts parts = new BodyParts();
        collectParts(payload, parts);

        String threadId = str(raw.get("threadId"));
        List<String> labelIds = stringList(raw.get("labelIds"));

        return CanonicalMessage.builder()
            .providerMessageId(messageId)
            .providerThreadId(threadId.isEmpty() ? messageId : threadId)
            .from(headers.getOrDefault("From", ""))
            .to(parseAddresses(headers.get("To")))
            .cc(parseAddresses(headers.get("Cc")))
            .bcc(parseAddresses(headers.get("Bcc")))
            .subject(headers.getOrDefault("Subject", ""))
            .date(parseDate(headers.get("Date"), raw.get("internalDate")))
            .bodyText(parts.text)
            .bodyHtml(parts.html)
            .snippet(str(raw.get("snippet")))
            .attachments(parts.attachments)
            .hasAttachments(!parts.attachments.isEmpty())
            .read(!labelIds.contains("UNREAD"))
            .build();
    }

    private void collectParts(Map<String, Object> part, BodyParts parts) {
        String mimeType = str(part.get("mimeType"));
        String filename = str(part.get("filename"));
        Map<String, Object> body = map(part.get("body"));
        String attachmentId = str(body.get("attachmentId"));

        if (!filename.isEmpty() && !attachmentId.isEmpty()) {
            parts.attachments.add(CanonicalMessage.CanonicalAttachment.builder()
                .filename(filename)
                .mimeType(mimeType)
                .size(number(body.get("size")))
                .providerAttachmentId(attachmentId)
                .build());
        } else if (body.get("data") != null) {
            String type = mimeType.toLowerCase(Locale.ROOT);
            if (type.equals("text/html")) {
                if (parts.html.isEmpty()) {
                    parts.html = decodeBase64(str(body.get("data")));
                }
            } else if (type.isEmpty() || type.startsWith("text/")) {
                if (parts.text.isEmpty()) {
                    parts.text = decodeBase64(str(body.get("data")));
                }
            }
        }

        for (Map<String, Object> child : mapList(part.get("parts"))) {
            collectParts(child, parts);
        }
    }

    private String decodeBase64(String data) {
        try {
            // Gmail uses URL-safe base64
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Undecodable Gmail body part: {}", e.getMessage());
            return "";
        }
    }

    private List<String> parseAddresses(String header) {
        if (header == null || header.isBlank()) {
            return List.of();
        }
        List<String> addresses = new ArrayList<>();
        try {
            for (InternetAddress address : InternetAddress.parseHeader(header, false)) {
                addresses.add(address.getAddress());
            }
        } catch (AddressException e) {
            for (String part : header.split(",")) {
                if (!part.isBlank()) {
                    addresses.add(part.trim());
                }
            }
        }
        return addresses;
    }

    private Instant parseDate(String dateHeader, Object internalDate) {
        if (dateHeader != null && !dateHeader.isBlank()) {
            try {
                return new MailDateFormat().parse(dateHeader).toInstant();
            } catch (ParseException e) {
                log.debug("Unparsable Date header '{}'", dateHeader);
            }
        }
        long epochMillis = number(internalDate);
        if (epochMillis > 0) {
            return Instant.ofEpochMilli(epochMillis);
        }
        return clock.instant();
    }

    @Override
    public ProviderSendResult sendMessage(String accessToken, OutgoingDraft draft) {
        String raw;
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            createMimeMessage(draft).writeTo(buffer);
            raw = Base64.getUrlEncoder().encodeToString(buffer.toByteArray());
        } catch (MessagingException | IOException e) {
            throw new MailSyncException("Could not build message: " + e.getMessage(), e);
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("raw", raw);
        if (draft.getProviderThreadId() != null) {
            payload.put("threadId", draft.getProviderThreadId());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> response = restTemplate.exchange(
                GMAIL_API_BASE + "/messages/send",
                HttpMethod.POST,
                new HttpEntity<>(payload, headers),
                Map.class
            ).getBody();

            Map<String, Object> sent = response != null ? response : Map.of();
            return new ProviderSendResult("sent", str(sent.get("id")), str(sent.get("threadId")));
        } catch (RestClientException e) {
            throw ProviderHttpErrors.translate("Gmail send", e);
        }
    }

    private MimeMessage createMimeMessage(OutgoingDraft draft) throws MessagingException {
        MimeMessage message = new MimeMessage(Session.getDefaultInstance(new Properties(), null));
        if (draft.getTo() != null && !draft.getTo().isEmpty()) {
            message.addRecipients(jakarta.mail.Message.RecipientType.TO,
                InternetAddress.parse(String.join(",", draft.getTo())));
        }
        if (draft.getCc() != null && !draft.getCc().isEmpty()) {
            message.addRecipients(jakarta.mail.Message.RecipientType.CC,
                InternetAddress.parse(String.join(",", draft.getCc())));
        }
        message.setSubject(draft.getSubject() != null ? draft.getSubject() : "", "UTF-8");
        if (draft.getInReplyTo() != null) {
            message.setHeader("In-Reply-To", draft.getInReplyTo());
        }
        if (draft.getReferences() != null) {
            message.setHeader("References", draft.getReferences());
        }

        String text = draft.getBodyText();
        String html = draft.getBodyHtml();
        if (text != null && html != null) {
            MimeMultipart alternative = new MimeMultipart("alternative");
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(text, "UTF-8");
            alternative.addBodyPart(textPart);
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setContent(html, "text/html; charset=UTF-8");
            alternative.addBodyPart(htmlPart);
            message.setContent(alternative);
        } else if (html != null) {
            message.setContent(html, "text/html; charset=UTF-8");
        } else {
            message.setText(text != null ? text : "", "UTF-8");
        }
        message.saveChanges();
        return message;
    }

    private ProviderCredential postTokenRequest(MultiValueMap<String, String> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        return restTemplate.postForObject(TOKEN_URL, new HttpEntity<>(body, headers), ProviderCredential.class);
    }

    private Map<String, Object> getJson(String url, String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);

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

    private static class BodyParts {
        private String text = "";
        private String html = "";
        private final List<CanonicalMessage.CanonicalAttachment> attachments = new ArrayList<>();
    }
}
