package com.company.reliability.config;

import com.company.reliability.notification.AlertNotifier;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AlertNotifier alertNotifier;

    @Bean
    public MeterBinder reliabilityMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("reliability.notifications.channels", alertNotifier,
                            notifier -> notifier.getChannelNames().size())
                    .description("Number of registered notification channels")
                    .register(reg);

            log.info("Custom metrics registered");
        };
    }
}
