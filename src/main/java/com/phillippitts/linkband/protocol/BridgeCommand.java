package com.phillippitts.linkband.protocol;

import org.json.JSONObject;

import java.util.Map;
import java.util.Objects;

/**
 * Client-to-bridge commands.
 *
 * <p>Encoded as {@code {"type":"command","command":<name>,"payload"?:{...}}}; the payload key is
 * omitted entirely when there is nothing to send.
 */
public enum BridgeCommand {
    CHECK_DEVICE_CONNECTION("check_device_connection"),
    CHECK_BLUETOOTH_STATUS("check_bluetooth_status"),
    SCAN_DEVICES("scan_devices"),
    CONNECT_DEVICE("connect_device"),
    DISCONNECT_DEVICE("disconnect_device"),
    START_STREAMING("start_streaming"),
    STOP_STREAMING("stop_streaming"),
    HEALTH_CHECK("health_check");

    private final String wireName;

    BridgeCommand(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Encodes this command without a payload. */
    public String encode() {
        return encode(Map.of());
    }

    /**
     * Encodes this command with the given payload.
     *
     * @param payload payload fields; empty map omits the payload key
     * @return JSON text ready to send
     */
    public String encode(Map<String, ?> payload) {
        Objects.requireNonNull(payload, "payload");
        JSONObject obj = new JSONObject();
        obj.put("type", "command");
        obj.put("command", wireName);
        if (!payload.isEmpty()) {
            obj.put("payload", new JSONObject(payload));
        }
        return obj.toString();
    }

    /**
     * Encodes a {@code connect_device} command for the given Bluetooth address.
     *
     * @throws IllegalArgumentException if address is blank
     */
    public static String connectDevice(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        return CONNECT_DEVICE.encode(Map.of("address", address));
    }
}
