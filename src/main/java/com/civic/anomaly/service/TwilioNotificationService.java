package com.civic.anomaly.service;

import com.civic.anomaly.config.MetricsConfig;
import com.civic.anomaly.config.TwilioNotificationConfig;
import com.civic.anomaly.model.Alert;
import com.civic.anomaly.model.ScanReport;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    /**
     * Sends a message composed by {@link #buildMessageBody} on the calling thread, so
     * nothing mutable crosses into the async send.
     */
    @Async
    @Observed(name = "notification.send", contextualName = "send-alert-notification")
    public void notifyAlerts(String scanId, String body) {
        if (!config.isEnabled() || body == null || body.isEmpty()) {
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Alert notification sent for scan={}, sid={}", scanId, message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send alert notification for scan={}: {}", scanId, e.getMessage(), e);
        }
    }

    public static String buildMessageBody(ScanReport report, List<Alert> alerts) {
        StringBuilder body = new StringBuilder();
        body.append("[ANOMALY ALERT] Scan ").append(report.getStatus() != null ? report.getStatus().getValue() : "")
                .append('\n')
                .append("Scan ID: ").append(report.getScanId()).append('\n')
                .append("New anomalies: ").append(report.totalAnomaliesCreated()).append('\n');
        for (Alert alert : alerts) {
            body.append("- [").append(alert.severity() != null ? alert.severity().getValue() : "n/a").append("] ")
                    .append(alert.message()).append('\n');
        }
        return body.toString().trim();
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
