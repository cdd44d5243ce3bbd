package net.spookly.arbiter.admission;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Items waiting for the shared flush timer, kept in enqueue order.
 */
final class BatchQueue {
    private List<Item> items = new ArrayList<>();

    int enqueue(Item item) {
        items.add(item);
        return items.size();
    }

    /**
     * Take every queued item at once, leaving the queue empty.
     */
    List<Item> drain() {
        List<Item> drained = items;
        items = new ArrayList<>();
        return drained;
    }

    boolean isEmpty() {
        return items.isEmpty();
    }

    int size() {
        return items.size();
    }

    @Getter
    @Accessors(fluent = true)
    @AllArgsConstructor
    static final class Item {
        private final String requestKey;
        private final JsonNode payload;
        private final ResponseGuard guard;
    }
}
