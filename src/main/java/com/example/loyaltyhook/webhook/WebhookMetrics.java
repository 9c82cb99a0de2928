package com.example.loyaltyhook.webhook;

import com.example.loyaltyhook.model.WebhookTopic;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Webhook 处理指标。
 */
@Component
@RequiredArgsConstructor
public class WebhookMetrics {

    public static final String PROCESSING_TIMER = "loyalty.webhook.processing";
    public static final String POINTS_COUNTER = "loyalty.points";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_BAD_REQUEST = "bad_request";

    private final MeterRegistry meterRegistry;

    public Timer.Sample start() {
        return Timer.start(meterRegistry);
    }

    public void stop(Timer.Sample sample, WebhookTopic topic, String outcome) {
        sample.stop(Timer.builder(PROCESSING_TIMER)
                .tag("topic", topic.getValue())
                .tag("outcome", outcome)
                .register(meterRegistry));
    }

    public void recordPointsAwarded(long points) {
        pointsCounter("awarded").increment(points);
    }

    public void recordPointsDeducted(long points) {
        pointsCounter("deducted").increment(points);
    }

    private Counter pointsCounter(String direction) {
        return Counter.builder(POINTS_COUNTER)
                .tag("direction", direction)
                .register(meterRegistry);
    }
}
