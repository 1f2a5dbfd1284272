package com.liquidityledger.amm;

import com.liquidityledger.domain.Pool;
import com.liquidityledger.domain.SwapRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory arena of pools and their swap history. Holds the authoritative Pool instances; they are mutated
 * only under the pool's lock.
 */
@Component
public class PoolBook {

    private final Map<String, Pool> pools = new ConcurrentHashMap<>();
    private final Map<String, List<SwapRecord>> swaps = new ConcurrentHashMap<>();

    /** @return false when a pool with the same id already exists */
    boolean add(Pool pool) {
        if (pools.putIfAbsent(pool.getId(), pool) != null) {
            return false;
        }
        historyOf(pool.getId());
        return true;
    }

    Optional<Pool> find(String poolId) {
        return poolId == null ? Optional.empty() : Optional.ofNullable(pools.get(poolId));
    }

    Pool require(String poolId) {
        return find(poolId).orElseThrow(() -> new PoolLedgerException(
                PoolLedgerException.POOL_NOT_FOUND, "Pool not found: " + poolId));
    }

    Collection<Pool> all() {
        return pools.values();
    }

    void appendSwap(SwapRecord swap) {
        historyOf(swap.poolId()).add(swap);
    }

    List<SwapRecord> swapsOf(String poolId) {
        List<SwapRecord> history = swaps.get(poolId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    int swapCount() {
        return swaps.values().stream().mapToInt(List::size).sum();
    }

    /** A pool is published before its history list, so either side may create it. */
    private List<SwapRecord> historyOf(String poolId) {
        return swaps.computeIfAbsent(poolId, id -> Collections.synchronizedList(new ArrayList<>()));
    }
}
