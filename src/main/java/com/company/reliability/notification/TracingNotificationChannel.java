package com.company.reliability.notification;

import com.company.reliability.domain.AlertEvent;
import com.company.reliability.domain.ChannelDeliveryResult;
import com.company.reliability.secrets.SecretResolver;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Publishes alerts as span events so the tracing backend's alerting picks
 * them up.
 */
@Component
@Slf4j
public class TracingNotificationChannel implements NotificationChannel {

    public static final String NAME = "tracing";

    private final Tracer tracer;
    private final SecretResolver secretResolver;
    private final String defaultRoutingKey;

    public TracingNotificationChannel(Tracer tracer, SecretResolver secretResolver,
                                      @Value("${reliability.notifications.tracing.routing-key:reliability-oncall}")
                                      String defaultRoutingKey) {
        this.tracer = tracer;
        this.secretResolver = secretResolver;
        this.defaultRoutingKey = defaultRoutingKey;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ChannelDeliveryResult sendAlert(AlertEvent event, String explanation) {
        Span span = tracer.spanBuilder("slo.alert")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            String routingKey = secretResolver.getSecret("alerts/routing-key").orElse(defaultRoutingKey);

            span.setAttribute("alert.id", event.getId());
            span.setAttribute("alert.rule_id", String.valueOf(event.getRuleId()));
            span.setAttribute("alert.routing_key", routingKey);
            span.setAttribute("service.name", event.getService());
            span.setAttribute("slo.id", String.valueOf(event.getSloId()));
            span.setAttribute("severity", event.getSeverity().getValue());

            span.addEvent(event.getTitle(),
                    Attributes.of(
                            AttributeKey.stringKey("message"), event.getMessage(),
                            AttributeKey.stringKey("explanation"), explanation != null ? explanation : ""
                    ));

            log.info("Alert {} for {} published to tracing backend", event.getId(), event.getService());
            return ChannelDeliveryResult.sent(NAME);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to publish alert");
            log.error("Failed to publish alert {} to tracing backend", event.getId(), e);
            return ChannelDeliveryResult.failed(NAME, e.getMessage());
        } finally {
            span.end();
        }
    }
}
