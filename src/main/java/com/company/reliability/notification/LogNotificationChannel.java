package com.company.reliability.notification;

import com.company.reliability.domain.AlertEvent;
import com.company.reliability.domain.ChannelDeliveryResult;
import com.company.reliability.domain.enums.AlertSeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes alerts to the application log; info alerts are skipped.
 */
@Component
@Slf4j
public class LogNotificationChannel implements NotificationChannel {

    public static final String NAME = "log";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ChannelDeliveryResult sendAlert(AlertEvent event, String explanation) {
        if (event.getSeverity() == AlertSeverity.INFO) {
            return ChannelDeliveryResult.skipped(NAME, "info alerts are not logged");
        }

        if (event.getSeverity() == AlertSeverity.CRITICAL) {
            log.error("[{}] {}: {}", event.getSeverity().getValue(), event.getTitle(), event.getMessage());
        } else {
            log.warn("[{}] {}: {}", event.getSeverity().getValue(), event.getTitle(), event.getMessage());
        }
        if (explanation != null) {
            log.info("Alert {} explanation: {}", event.getId(), explanation);
        }
        return ChannelDeliveryResult.sent(NAME);
    }
}
