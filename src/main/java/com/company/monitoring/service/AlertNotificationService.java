package com.company.monitoring.service;

import com.company.monitoring.domain.AlertEvent;
import com.company.monitoring.domain.MonitoringConfig;
import com.company.monitoring.domain.MonitoringConfig.CategorySettings;
import com.company.monitoring.domain.MonitoringConfig.WebhookPolicy;
import com.company.monitoring.event.AlertsRaisedEvent;
import com.company.monitoring.exception.NotificationDispatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Delivers the alerts of a cycle to the configured webhook channels.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertNotificationService {

    private static final String TITLE = "Header Monitoring";

    private final WebhookAlertSender sender;
    private final MonitoringConfigManager configManager;
    private final MonitoredItemRegistry registry;
    private final Clock clock;

    private final Map<String, Instant> lastNotified = new ConcurrentHashMap<>();

    @Value("${monitoring.notifications.default-interval-ms:300000}")
    private long defaultIntervalMs = 300_000L;

    @EventListener
    @Async("notificationExecutor")
    public void handleAlertsRaised(AlertsRaisedEvent event) {
        log.debug("Dispatching {} alerts from cycle {}", event.getAlerts().size(), event.getCycleId());
        dispatch(event.getAlerts());
    }

    /**
     * @return the alerts that passed filtering and were handed to the channels
     */
    public List<AlertEvent> dispatch(List<AlertEvent> alerts) {
        MonitoringConfig config = configManager.current();
        WebhookPolicy policy = config.getWebhookPolicy();
        if (!policy.isEnabled() || alerts.isEmpty()) {
            return List.of();
        }

        List<AlertEvent> byType = alerts.stream()
                .filter(alert -> typeEnabled(policy, alert))
                .collect(Collectors.toList());
        if (byType.isEmpty()) {
            log.debug("No alerts to send after type filtering");
            return List.of();
        }

        Instant now = clock.instant();
        List<AlertEvent> toSend = new ArrayList<>();
        for (AlertEvent alert : byType) {
            Instant last = lastNotified.get(alert.getHeaderId());
            if (last == null || now.toEpochMilli() - last.toEpochMilli() >= notificationIntervalMs(config, alert)) {
                toSend.add(alert);
            }
        }
        if (toSend.isEmpty()) {
            log.debug("No alerts to send after notification interval filtering");
            return List.of();
        }

        if (policy.isSlackEnabled() && policy.getSlackWebhookUrl() != null) {
            deliver("slack", policy.getSlackWebhookUrl(), slackPayload(toSend, now), toSend.size());
        }
        if (policy.isTeamsEnabled() && policy.getTeamsWebhookUrl() != null) {
            deliver("teams", policy.getTeamsWebhookUrl(), teamsPayload(toSend), toSend.size());
        }
        for (String url : policy.getCustomWebhooks()) {
            deliver("custom", url, customPayload(toSend, now), toSend.size());
        }

        // Failed deliveries still count, otherwise a dead channel is retried every cycle
        for (AlertEvent alert : toSend) {
            lastNotified.put(alert.getHeaderId(), now);
        }
        return toSend;
    }

    private void deliver(String channel, String url, Map<String, Object> payload, int count) {
        try {
            sender.send(channel, url, payload, count);
        } catch (NotificationDispatchException e) {
            log.error("Failed to deliver alerts to {}: {}", channel, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error delivering alerts to {}", channel, e);
        }
    }

    private static boolean typeEnabled(WebhookPolicy policy, AlertEvent alert) {
        switch (alert.getType()) {
            case THRESHOLD:
                return policy.isSendThresholdAlerts();
            case FROZEN:
                return policy.isSendFrozenAlerts();
            case ERROR:
                return policy.isSendErrorAlerts();
            default:
                return true;
        }
    }

    long notificationIntervalMs(MonitoringConfig config, AlertEvent alert) {
        String category = registry.find(alert.getHeaderId()).map(item -> item.getCategory()).orElse(null);
        CategorySettings settings = category != null ? config.getPatternCategories().get(category) : null;
        if (settings != null && settings.getNotificationIntervalMs() != null) {
            return settings.getNotificationIntervalMs();
        }
        return defaultIntervalMs;
    }

    Map<String, Object> slackPayload(List<AlertEvent> alerts, Instant now) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(Map.of("type", "header",
                "text", Map.of("type", "plain_text", "text", summary(alerts), "emoji", true)));
        blocks.add(Map.of("type", "divider"));
        for (AlertEvent alert : alerts) {
            blocks.add(Map.of("type", "section",
                    "text", Map.of("type", "mrkdwn", "text",
                            "*" + title(alert) + "*\n*Header:* " + alert.getHeaderName() + "\n" + alert.getMessage())));
            blocks.add(Map.of("type", "divider"));
        }
        blocks.add(Map.of("type", "context",
                "elements", List.of(Map.of("type", "mrkdwn", "text", "*Sent:* " + now))));
        return Map.of("blocks", blocks);
    }

    Map<String, Object> teamsPayload(List<AlertEvent> alerts) {
        List<Map<String, Object>> sections = new ArrayList<>();
        for (AlertEvent alert : alerts) {
            sections.add(Map.of(
                    "activityTitle", title(alert),
                    "activitySubtitle", String.valueOf(alert.getHeaderName()),
                    "text", String.valueOf(alert.getMessage()),
                    "facts", List.of(
                            Map.of("name", "Type", "value", alert.getType().wireName()),
                            Map.of("name", "Time", "value", String.valueOf(alert.getTimestamp())))));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("@type", "MessageCard");
        payload.put("@context", "http://schema.org/extensions");
        payload.put("themeColor", "0076D7");
        payload.put("summary", summary(alerts));
        payload.put("sections", sections);
        return payload;
    }

    Map<String, Object> customPayload(List<AlertEvent> alerts, Instant now) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (AlertEvent alert : alerts) {
            // LinkedHashMap because value and threshold may be null
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", alert.getId());
            item.put("type", alert.getType().wireName());
            item.put("headerName", alert.getHeaderName());
            item.put("headerId", alert.getHeaderId());
            item.put("value", alert.getValue());
            item.put("threshold", alert.getThreshold());
            item.put("timestamp", String.valueOf(alert.getTimestamp()));
            item.put("message", alert.getMessage());
            items.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", summary(alerts));
        payload.put("timestamp", now.toString());
        payload.put("alerts", items);
        return payload;
    }

    private static String summary(List<AlertEvent> alerts) {
        return TITLE + " - " + alerts.size() + (alerts.size() > 1 ? " Alerts" : " Alert");
    }

    private static String title(AlertEvent alert) {
        switch (alert.getType()) {
            case THRESHOLD:
                return "Threshold Alert";
            case FROZEN:
                return "Frozen Data Alert";
            default:
                return "Monitoring Error";
        }
    }
}
