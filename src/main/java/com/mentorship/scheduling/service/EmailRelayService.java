package com.mentorship.scheduling.service;

import com.mentorship.scheduling.port.EmailPort;
import com.mentorship.scheduling.port.NotificationKind;
import com.mentorship.scheduling.port.UserProfile;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands session e-mails to an HTTP mail relay, which owns templates and delivery.
 */
@Service
public class EmailRelayService implements EmailPort {

    private static final Logger log = LoggerFactory.getLogger(EmailRelayService.class);

    @Value("${notifications.email.relay-url:}")
    private String relayUrl;

    @Value("${notifications.email.from:no-reply@mentorship.local}")
    private String from;

    private final RestTemplate restTemplate;

    public EmailRelayService(RestTemplateBuilder builder) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void send(UserProfile recipient, NotificationKind kind, Map<String, Object> payload) {
        if (StringUtils.isBlank(relayUrl)) {
            log.warn("E-mail relay not configured; skipping {} for user {}", kind.wireValue(), recipient.id());
            return;
        }
        if (StringUtils.isBlank(recipient.email())) {
            log.debug("User {} has no e-mail address; skipping {}", recipient.id(), kind.wireValue());
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from);
        body.put("to", recipient.email());
        body.put("name", recipient.displayName());
        body.put("template", kind.wireValue());
        body.put("timezone", recipient.timezone());
        body.put("data", payload);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(relayUrl, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("E-mail relay returned {} for {} to user {}", response.getStatusCode(), kind.wireValue(), recipient.id());
            }
        } catch (Exception e) {
            log.error("E-mail delivery failed for {} to user {}", kind.wireValue(), recipient.id(), e);
        }
    }
}
