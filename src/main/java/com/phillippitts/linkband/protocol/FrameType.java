package com.phillippitts.linkband.protocol;

import java.util.Optional;

/** Kinds of server-to-client sensor frames. */
public enum FrameType {
    RAW_DATA("raw_data"),
    PROCESSED_DATA("processed_data"),
    SENSOR_DATA("sensor_data");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FrameType> fromWire(String value) {
        for (FrameType t : values()) {
            if (t.wireName.equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
