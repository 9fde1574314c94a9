package com.company.reliability.domain;

import com.company.reliability.domain.enums.DeliveryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelDeliveryResult {
    private String channel;
    private DeliveryStatus status;
    private String error;

    public static ChannelDeliveryResult sent(String channel) {
        return new ChannelDeliveryResult(channel, DeliveryStatus.SENT, null);
    }

    public static ChannelDeliveryResult skipped(String channel, String reason) {
        return new ChannelDeliveryResult(channel, DeliveryStatus.SKIPPED, reason);
    }

    public static ChannelDeliveryResult failed(String channel, String error) {
        return new ChannelDeliveryResult(channel, DeliveryStatus.FAILED, error);
    }
}
