package com.stagewise.engine.api.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Ephemeral cache of serialized session state. Losing an entry is always
 * safe; the durable document store is the source of truth.
 */
public interface StateCache {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    void evict(String key);
}
