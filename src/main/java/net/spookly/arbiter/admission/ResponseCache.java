package net.spookly.arbiter.admission;

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Exact-key response cache; entries are never evicted, staleness is checked on read.
 */
final class ResponseCache {
    private final Map<String, CacheEntry> entries = new HashMap<>();

    /**
     * Entry for {@code key} if it is younger than {@code ttlMs}, else null.
     */
    CacheEntry getFresh(String key, long now, long ttlMs) {
        CacheEntry entry = entries.get(key);
        if (entry == null || now - entry.timestamp() >= ttlMs) {
            return null;
        }
        return entry;
    }

    void put(String key, JsonNode response, long now) {
        entries.put(key, new CacheEntry(response, now));
    }

    int size() {
        return entries.size();
    }

    @Getter
    @Accessors(fluent = true)
    @AllArgsConstructor
    static final class CacheEntry {
        private final JsonNode response;
        private final long timestamp;
    }
}
