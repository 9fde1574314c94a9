package com.company.reliability.notification;

import com.company.reliability.domain.AlertEvent;
import com.company.reliability.domain.ChannelDeliveryResult;
import com.company.reliability.secrets.SecretResolver;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fans one alert out to its channels in parallel. Each channel runs behind
 * its own circuit breaker; a failing or open channel is recorded in the
 * result map and never affects the others. No retries happen here.
 */
@Service
@Slf4j
public class AlertNotifier {

    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final SecretResolver secretResolver;
    private final MeterRegistry meterRegistry;
    private final Executor executor;

    public AlertNotifier(List<NotificationChannel> channels,
                         CircuitBreakerRegistry circuitBreakerRegistry,
                         SecretResolver secretResolver,
                         MeterRegistry meterRegistry,
                         @Qualifier("notificationExecutor") Executor executor) {
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.getName(), channel);
        }
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.secretResolver = secretResolver;
        this.meterRegistry = meterRegistry;
        this.executor = executor;
    }

    /**
     * @param channelNames channels to use; empty means every registered
     *                     channel. Names may contain secret references.
     * @return delivery result per channel name
     */
    public Map<String, ChannelDeliveryResult> sendAlert(AlertEvent event, List<String> channelNames,
                                                        String explanation) {
        List<String> targets = resolveTargets(channelNames);
        Map<String, CompletableFuture<ChannelDeliveryResult>> pending = new LinkedHashMap<>();

        for (String name : targets) {
            NotificationChannel channel = channels.get(name);
            if (channel == null) {
                pending.put(name, CompletableFuture.completedFuture(
                        ChannelDeliveryResult.failed(name, "unknown channel")));
                continue;
            }
            pending.put(name, CompletableFuture
                    .supplyAsync(() -> deliver(channel, event, explanation), executor)
                    .exceptionally(e -> ChannelDeliveryResult.failed(name, e.getMessage())));
        }

        Map<String, ChannelDeliveryResult> results = new LinkedHashMap<>();
        pending.forEach((name, future) -> {
            ChannelDeliveryResult result = future.join();
            results.put(name, result);
            meterRegistry.counter("reliability.notifications",
                    "channel", name,
                    "status", result.getStatus().getValue()
            ).increment();
        });

        log.info("Alert {} dispatched to {} channel(s): {}", event.getId(), results.size(), summarize(results));
        return results;
    }

    public List<String> getChannelNames() {
        return new ArrayList<>(channels.keySet());
    }

    private ChannelDeliveryResult deliver(NotificationChannel channel, AlertEvent event, String explanation) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker("notification-" + channel.getName());
        try {
            return circuitBreaker.executeSupplier(() -> channel.sendAlert(event, explanation));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for channel {}, alert {} not sent", channel.getName(), event.getId());
            return ChannelDeliveryResult.failed(channel.getName(), "circuit open");
        } catch (Exception e) {
            log.error("Channel {} failed for alert {}", channel.getName(), event.getId(), e);
            return ChannelDeliveryResult.failed(channel.getName(), e.getMessage());
        }
    }

    private List<String> resolveTargets(List<String> channelNames) {
        if (channelNames == null || channelNames.isEmpty()) {
            return new ArrayList<>(channels.keySet());
        }
        List<String> targets = new ArrayList<>();
        for (String name : channelNames) {
            String resolved = secretResolver.resolveReferences(name);
            if (!targets.contains(resolved)) {
                targets.add(resolved);
            }
        }
        return targets;
    }

    private String summarize(Map<String, ChannelDeliveryResult> results) {
        StringBuilder summary = new StringBuilder();
        results.forEach((name, result) -> {
            if (summary.length() > 0) {
                summary.append(", ");
            }
            summary.append(name).append('=').append(result.getStatus().getValue());
        });
        return summary.toString();
    }
}
