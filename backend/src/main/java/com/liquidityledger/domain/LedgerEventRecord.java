package com.liquidityledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted ledger event. Stored in ledger_events; append-only audit trail of committed ledger changes.
 * Payload holds the event's fields; decimals are stored as Decimal128.
 */
@Document(collection = "ledger_events")
@CompoundIndex(name = "aggregate_time", def = "{'aggregateId': 1, 'occurredAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerEventRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String eventType;
    private String aggregateId;
    private Instant occurredAt;
    private Map<String, Object> payload;
    private Instant recordedAt;
}
