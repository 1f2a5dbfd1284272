package com.liquidityledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for ledger_events.
 */
public interface LedgerEventRepository extends MongoRepository<LedgerEventRecord, String> {

    List<LedgerEventRecord> findByAggregateIdOrderByOccurredAtAsc(String aggregateId);

    long countByEventType(String eventType);
}
