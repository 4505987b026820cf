package com.phillippitts.linkband.protocol;

import java.util.Locale;
import java.util.Optional;

/**
 * Sensor channels streamed by the bridge. Wire names are fixed by the bridge protocol.
 */
public enum SensorType {
    EEG("eeg"),
    PPG("ppg"),
    ACC("acc"),
    BATTERY("bat");

    private final String wireName;

    SensorType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name. Older bridge builds spell the battery channel {@code "battery"}.
     *
     * @param value wire value, case-insensitive
     * @return matching sensor type, or empty when unknown
     */
    public static Optional<SensorType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if ("battery".equals(v)) {
            return Optional.of(BATTERY);
        }
        for (SensorType t : values()) {
            if (t.wireName.equals(v)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
