package com.liquidityledger.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.liquidityledger.config.AsyncConfig;
import com.liquidityledger.domain.LedgerEvent;
import com.liquidityledger.domain.LedgerEventRecord;
import com.liquidityledger.domain.LedgerEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists every ledger event to ledger_events on audit-executor. Storage failures are logged and dropped; they
 * never reach the ledger operation that published the event.
 */
@Service
@Slf4j
public class LedgerEventStore {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final LedgerEventRepository ledgerEventRepository;
    private final ObjectMapper payloadMapper;
    private final Clock clock;

    public LedgerEventStore(LedgerEventRepository ledgerEventRepository, ObjectMapper objectMapper, Clock clock) {
        this.ledgerEventRepository = ledgerEventRepository;
        this.payloadMapper = objectMapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
    }

    @EventListener
    @Async(AsyncConfig.AUDIT_EXECUTOR)
    public void onLedgerEvent(LedgerEvent event) {
        try {
            record(event);
        } catch (Exception e) {
            log.error("Failed to persist {} for {}", event.getClass().getSimpleName(), event.aggregateId(), e);
        }
    }

    /**
     * Store one event synchronously.
     *
     * @return the stored record, empty when the event has no aggregate id
     */
    public Optional<LedgerEventRecord> record(LedgerEvent event) {
        if (event.aggregateId() == null) {
            log.warn("Skipping {} without aggregate id", event.getClass().getSimpleName());
            return Optional.empty();
        }
        LedgerEventRecord record = new LedgerEventRecord();
        record.setEventType(event.getClass().getSimpleName());
        record.setAggregateId(event.aggregateId());
        record.setOccurredAt(event.occurredAt());
        record.setPayload(payloadMapper.convertValue(event, PAYLOAD_TYPE));
        record.setRecordedAt(Instant.now(clock));
        LedgerEventRecord saved = ledgerEventRepository.save(record);
        log.debug("Stored {} {} for {}", saved.getEventType(), saved.getId(), saved.getAggregateId());
        return Optional.of(saved);
    }

    /** Stored events of one pool, position or validator, oldest first. */
    public List<LedgerEventRecord> history(String aggregateId) {
        return ledgerEventRepository.findByAggregateIdOrderByOccurredAtAsc(aggregateId);
    }
}
