package com.flagship.fundraising_ledger.outbox;

import com.flagship.fundraising_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and sends pending financial notifications to Kafka.
 *
 * Events go to the financials topic keyed by club id, one at a time and
 * in sequence order, so consumers see a club's changes in the order they
 * were committed. A failed send is retried on later polls until
 * outbox.publisher.max-retries is reached; after that the event stays in
 * the table as a dead letter and is counted by {@link OutboxMetrics}.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.financials:fundraising.financials}")
    private String financialsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                publish(event);
            }
        } catch (Exception e) {
            log.error("Outbox polling failed", e);
        }
    }

    private void publish(OutboxEvent event) {
        String key = event.getAggregateId().toString();
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(financialsTopic, key, event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published {} {} to {}-{}@{}", event.getEventType(), event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish {} {}: {}", event.getEventType(), event.getId(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Outbox event {} reached {} attempts and will not be retried", event.getId(), maxRetries);
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    public void triggerPublish() {
        publishPendingEvents();
    }
}
