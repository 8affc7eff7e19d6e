package com.flagship.fundraising_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes change notifications to the outbox and tracks their delivery.
 *
 * {@link #saveEvent} joins the caller's transaction: if the ledger write or
 * summary update rolls back, so does its notification. Publishing happens
 * elsewhere, in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String CLUB_AGGREGATE = "Club";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Stores a notification about a club in the current transaction.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException
     *         if no transaction is active
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveClubEvent(UUID clubId, String eventType, Object payload) {
        return saveEvent(CLUB_AGGREGATE, clubId, eventType, payload);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, serialize(payload));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Queued outbox event: type={}, aggregate={}/{}", eventType, aggregateType, aggregateId);
        return saved.toDomain();
    }

    /**
     * Locks and returns the next batch to publish, skipping rows another
     * publisher holds.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Outbox event {} failed (attempt {}): {}", eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForClub(UUID clubId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(CLUB_AGGREGATE, clubId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize outbox payload", e);
        }
    }
}
