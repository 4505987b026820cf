package com.phillippitts.linkband.protocol;

import java.util.Map;
import java.util.Objects;

/**
 * Bridge event frame.
 *
 * @param type decoded event type
 * @param data event payload as plain Java values
 */
public record BridgeEvent(BridgeEventType type, Map<String, Object> data) implements BridgeMessage {

    public BridgeEvent {
        Objects.requireNonNull(type, "type");
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    /** Returns the boolean at {@code key}, or {@code fallback} when absent or not a boolean. */
    public boolean flag(String key, boolean fallback) {
        Object v = data.get(key);
        return v instanceof Boolean b ? b : fallback;
    }
}
