package com.mentorship.scheduling.service;

import com.mentorship.scheduling.port.NotificationKind;
import com.mentorship.scheduling.port.NotificationPort;
import com.mentorship.scheduling.port.UserDirectory;
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
import java.util.Optional;

/**
 * Posts notifications to a push gateway as JSON. Without a configured gateway, or for a user without
 * a push token, delivery is skipped with a log line.
 */
@Service
public class PushNotificationService implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(PushNotificationService.class);

    @Value("${notifications.push.url:}")
    private String gatewayUrl;

    @Value("${notifications.push.api-key:}")
    private String apiKey;

    private final RestTemplate restTemplate;
    private final UserDirectory userDirectory;

    public PushNotificationService(RestTemplateBuilder builder, UserDirectory userDirectory) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
        this.userDirectory = userDirectory;
    }

    @Override
    public void notify(Long userId, NotificationKind kind, Map<String, Object> payload) {
        if (StringUtils.isBlank(gatewayUrl)) {
            log.warn("Push gateway not configured; skipping {} for user {}", kind.wireValue(), userId);
            return;
        }
        Optional<UserProfile> user = userDirectory.getUser(userId);
        if (user.isEmpty() || StringUtils.isBlank(user.get().pushToken())) {
            log.debug("No push token for user {}; skipping {}", userId, kind.wireValue());
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(apiKey)) {
            headers.setBearerAuth(apiKey);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", user.get().pushToken());
        body.put("userId", userId);
        body.put("kind", kind.wireValue());
        body.put("data", payload);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(gatewayUrl, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("Push gateway returned {} for {} to user {}", response.getStatusCode(), kind.wireValue(), userId);
            }
        } catch (Exception e) {
            log.error("Push delivery failed for {} to user {}", kind.wireValue(), userId, e);
        }
    }
}
