package com.example.perfoptimizer.notification;

import com.example.perfoptimizer.config.OptimizerProperties;
import com.example.perfoptimizer.event.OrchestratorEvent;
import com.example.perfoptimizer.event.OrchestratorEventListener;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Forwards alert and incident events to Slack and, for critical/high severity, PagerDuty.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService implements OrchestratorEventListener {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OptimizerProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(OrchestratorEvent.Type type) {
        return type == OrchestratorEvent.Type.ALERT || type == OrchestratorEvent.Type.INCIDENT_CREATED;
    }

    @Override
    public void onEvent(OrchestratorEvent event) {
        OptimizerProperties.NotificationConfig notifications = properties.getNotifications();
        if (notifications.getSlack().isEnabled()) {
            sendSlackNotification(event);
        }
        if (notifications.getPagerduty().isEnabled() && isPageWorthy(event.getSeverity())) {
            sendPagerDutyNotification(event);
        }
    }

    public void sendSlackNotification(OrchestratorEvent event) {
        String webhookUrl = properties.getNotifications().getSlack().getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            log.warn("Slack webhook URL not configured");
            return;
        }

        String emoji = switch (normalize(event.getSeverity())) {
            case "critical" -> ":rotating_light:";
            case "high", "warning" -> ":warning:";
            default -> ":information_source:";
        };
        String kind = event.getType() == OrchestratorEvent.Type.INCIDENT_CREATED ? "Incident" : "Alert";
        Map<String, Object> payload = Map.of(
                "text", String.format("%s *[%s] %s*\n%s\nSource: %s",
                        emoji, normalize(event.getSeverity()).toUpperCase(Locale.ROOT), kind,
                        event.getMessage(), event.getSource() != null ? event.getSource() : "optimizer"),
                "username", "Performance Optimizer",
                "icon_emoji", ":robot_face:"
        );
        post(webhookUrl, payload, "Slack");
    }

    public void sendPagerDutyNotification(OrchestratorEvent event) {
        String apiKey = properties.getNotifications().getPagerduty().getApiKey();
        if (apiKey == null || apiKey.isEmpty()) {
            log.warn("PagerDuty API key not configured");
            return;
        }

        Map<String, Object> payload = Map.of(
                "routing_key", apiKey,
                "event_action", "trigger",
                "payload", Map.of(
                        "summary", String.valueOf(event.getMessage()),
                        "severity", "critical".equals(normalize(event.getSeverity())) ? "critical" : "error",
                        "source", "perf-optimizer",
                        "custom_details", Map.of(
                                "type", event.getType().getValue(),
                                "rule", event.getSource() != null ? event.getSource() : ""
                        )
                )
        );
        post(properties.getNotifications().getPagerduty().getEventsUrl(), payload, "PagerDuty");
    }

    private void post(String url, Map<String, Object> payload, String channel) {
        try {
            String json = objectMapper.writeValueAsString(payload);
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.info("{} notification sent", channel);
                } else {
                    log.error("{} notification failed: {}", channel, response.code());
                }
            }
        } catch (IOException e) {
            log.error("Failed to send {} notification: {}", channel, e.getMessage());
        }
    }

    private static boolean isPageWorthy(String severity) {
        String s = normalize(severity);
        return "critical".equals(s) || "high".equals(s);
    }

    private static String normalize(String severity) {
        return severity == null ? "info" : severity.trim().toLowerCase(Locale.ROOT);
    }
}
