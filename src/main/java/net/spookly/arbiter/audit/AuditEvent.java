package net.spookly.arbiter.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Single audit record emitted by the dispatcher or the admission governor.
 */
@Value
@Accessors(fluent = true)
public class AuditEvent {
    String name;
    Instant timestamp;
    Map<String, Object> fields;

    /**
     * Build an event; null field values are dropped and insertion order is kept.
     */
    public static AuditEvent of(String name, Instant timestamp, Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (fields != null) {
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
        }
        return new AuditEvent(name, timestamp, Collections.unmodifiableMap(copy));
    }

    public Object field(String key) {
        return fields.get(key);
    }
}
