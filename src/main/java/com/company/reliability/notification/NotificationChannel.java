package com.company.reliability.notification;

import com.company.reliability.domain.AlertEvent;
import com.company.reliability.domain.ChannelDeliveryResult;

/**
 * A destination for alert events. Delivery failures are reported in the
 * returned result rather than thrown.
 */
public interface NotificationChannel {

    String getName();

    ChannelDeliveryResult sendAlert(AlertEvent event, String explanation);
}
