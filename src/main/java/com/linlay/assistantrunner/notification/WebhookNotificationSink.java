package com.linlay.assistantrunner.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantrunner.config.NotificationProperties;
import com.linlay.assistantrunner.model.EscalationRequest;
import com.linlay.assistantrunner.model.ExtractedContact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts side effects as signed JSON to the configured webhook, fire-and-forget.
 * <p>
 * Signature: hex HMAC-SHA256 of {@code timestamp + "." + body} in {@code X-Assistant-Signature},
 * epoch seconds in {@code X-Assistant-Timestamp}.
 */
@Service
public class WebhookNotificationSink implements NotificationSink {

    public static final String TIMESTAMP_HEADER = "X-Assistant-Timestamp";
    public static final String SIGNATURE_HEADER = "X-Assistant-Signature";

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSink.class);

    private final NotificationProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public WebhookNotificationSink(NotificationProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(Math.max(100L, properties.getConnectTimeoutMs())))
            .build();
    }

    @Override
    public void contactCaptured(ExtractedContact contact) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", contact.name());
        data.put("phone", contact.phone());
        data.put("email", contact.email());
        data.put("comment", contact.comment());
        data.put("raw", contact.raw());
        post("contact_captured", contact.userId(), contact.threadId(), data);
    }

    @Override
    public void escalationRequested(EscalationRequest request) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", request.reason());
        post("escalation_requested", request.userId(), request.threadId(), data);
    }

    private void post(String type, String userId, String threadId, Map<String, Object> data) {
        if (!properties.isEnabled()) {
            return;
        }
        if (!StringUtils.hasText(properties.getUrl()) || !StringUtils.hasText(properties.getSecret())) {
            log.warn("Notification webhook enabled without url/secret, dropping {} for user={}", type, userId);
            return;
        }

        String body;
        String timestamp = String.valueOf(Instant.now().getEpochSecond());
        try {
            body = objectMapper.writeValueAsString(buildPayload(type, userId, threadId, data));
        } catch (Exception ex) {
            log.warn("Failed to build notification payload type={}, user={}", type, userId, ex);
            return;
        }

        String signature;
        try {
            signature = sign(properties.getSecret(), timestamp, body);
        } catch (Exception ex) {
            log.warn("Failed to sign notification payload type={}, user={}", type, userId, ex);
            return;
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(properties.getUrl().trim()))
                .timeout(Duration.ofMillis(Math.max(200L, properties.getRequestTimeoutMs())))
                .header("Content-Type", "application/json")
                .header(TIMESTAMP_HEADER, timestamp)
                .header(SIGNATURE_HEADER, signature)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        } catch (Exception ex) {
            log.warn("Invalid notification URL configured: {}", properties.getUrl(), ex);
            return;
        }

        httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
            .whenComplete((response, throwable) -> {
                if (throwable != null) {
                    log.warn("notification {} failed user={}, url={}", type, userId, properties.getUrl(), throwable);
                    return;
                }
                if (response == null || response.statusCode() >= 300) {
                    log.warn(
                        "notification {} rejected status={} user={}, url={}",
                        type,
                        response == null ? -1 : response.statusCode(),
                        userId,
                        properties.getUrl()
                    );
                }
            });
    }

    private Map<String, Object> buildPayload(String type, String userId, String threadId, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("userId", userId);
        payload.put("threadId", StringUtils.hasText(threadId) ? threadId : "");
        payload.put("data", data);
        payload.put("createdAt", Instant.now().toEpochMilli());
        return payload;
    }

    static String sign(String secret, String timestamp, String body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] digest = mac.doFinal((timestamp + "." + body).getBytes(StandardCharsets.UTF_8));
        StringBuilder hex = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }
}
