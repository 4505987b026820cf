package com.phillippitts.linkband.protocol;

import java.util.Optional;

/** Event names carried in {@code {"type":"event","event_type":...}} frames. */
public enum BridgeEventType {
    DEVICE_INFO("device_info"),
    DEVICE_CONNECTED("device_connected"),
    DEVICE_DISCONNECTED("device_disconnected"),
    DEVICE_CONNECTION_FAILED("device_connection_failed"),
    STREAM_STARTED("stream_started"),
    STREAM_STOPPED("stream_stopped"),
    BATTERY_STATUS("battery_status"),
    SIGNAL_QUALITY("signal_quality"),
    SCAN_RESULT("scan_result"),
    BLUETOOTH_STATUS("bluetooth_status"),
    REGISTERED_DEVICES("registered_devices"),
    ERROR("error");

    private final String wireName;

    BridgeEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<BridgeEventType> fromWire(String value) {
        for (BridgeEventType t : values()) {
            if (t.wireName.equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
