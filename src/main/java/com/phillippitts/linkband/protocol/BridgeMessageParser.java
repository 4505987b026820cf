package com.phillippitts.linkband.protocol;

import com.phillippitts.linkband.exception.ProtocolException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decodes bridge text frames into {@link BridgeMessage} instances.
 *
 * <p>Recognized shapes:
 * <ul>
 *   <li>{@code {"type":"raw_data"|"processed_data"|"sensor_data","sensor_type":...,"data":[...]}}</li>
 *   <li>{@code {"type":"event","event_type":...,"data":{...}}}</li>
 *   <li>{@code {"type":"health_check_response","status":"ok",...}}</li>
 * </ul>
 * Other well-formed types decode to {@link UnhandledMessage}.
 *
 * <p>Thread-safe: all methods are static and stateless.
 *
 * <p>Timestamps on the wire are float seconds; they are converted to epoch millis. A sample
 * object's own {@code timestamp} wins over the frame timestamp.
 *
 * @since 1.0
 */
public final class BridgeMessageParser {

    /** Frames above this size are rejected outright (4MB). */
    public static final int MAX_FRAME_CHARS = 4 * 1_048_576;

    private BridgeMessageParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses one inbound frame.
     *
     * @param text raw frame text
     * @return decoded message, never null
     * @throws ProtocolException if the frame is not valid JSON or violates the protocol
     */
    public static BridgeMessage parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("empty frame");
        }
        if (text.length() > MAX_FRAME_CHARS) {
            throw new ProtocolException("frame exceeds " + MAX_FRAME_CHARS + " chars (actual: " + text.length() + ")");
        }
        JSONObject obj;
        try {
            obj = new JSONObject(text);
        } catch (JSONException e) {
            throw new ProtocolException("not a JSON object", e);
        }

        String type = obj.optString("type", "");
        if (type.isEmpty()) {
            throw new ProtocolException("missing type");
        }
        if ("event".equals(type)) {
            return parseEvent(obj);
        }
        if ("health_check_response".equals(type)) {
            return parseHealthResponse(obj);
        }
        return FrameType.fromWire(type)
                .<BridgeMessage>map(frameType -> parseSensorFrame(frameType, obj))
                .orElseGet(() -> new UnhandledMessage(type));
    }

    private static BridgeMessage parseEvent(JSONObject obj) {
        String name = obj.optString("event_type", "");
        BridgeEventType eventType = BridgeEventType.fromWire(name)
                .orElse(null);
        if (eventType == null) {
            return new UnhandledMessage("event:" + name);
        }
        Object data = obj.opt("data");
        Map<String, Object> payload;
        if (data == null || data == JSONObject.NULL) {
            payload = Map.of();
        } else if (data instanceof JSONObject json) {
            payload = withoutNulls(json.toMap());
        } else {
            throw new ProtocolException("event " + name + " data is not an object");
        }
        return new BridgeEvent(eventType, payload);
    }

    private static HealthCheckResponse parseHealthResponse(JSONObject obj) {
        try {
            return new HealthCheckResponse(
                    obj.optString("status", ""),
                    obj.optInt("clients_connected", 0),
                    obj.optBoolean("is_streaming", false),
                    obj.optBoolean("device_connected", false));
        } catch (JSONException e) {
            throw new ProtocolException("invalid health_check_response", e);
        }
    }

    private static SensorFrame parseSensorFrame(FrameType frameType, JSONObject obj) {
        String sensorName = obj.optString("sensor_type", null);
        SensorType sensorType = SensorType.fromWire(sensorName)
                .orElseThrow(() -> new ProtocolException("unknown sensor_type: " + sensorName));

        JSONArray data = obj.optJSONArray("data");
        if (data == null) {
            throw new ProtocolException(frameType.wireName() + " frame without data array");
        }

        double frameSeconds = obj.optDouble("timestamp", Double.NaN);
        long frameMillis = Double.isNaN(frameSeconds) ? 0L : secondsToMillis(frameSeconds);

        List<Long> sampleTimes = new ArrayList<>(data.length());
        for (int i = 0; i < data.length(); i++) {
            double sampleSeconds = Double.NaN;
            JSONObject sample = data.optJSONObject(i);
            if (sample != null) {
                sampleSeconds = sample.optDouble("timestamp", Double.NaN);
            }
            if (!Double.isNaN(sampleSeconds)) {
                sampleTimes.add(secondsToMillis(sampleSeconds));
            } else if (!Double.isNaN(frameSeconds)) {
                sampleTimes.add(frameMillis);
            } else {
                throw new ProtocolException("sample " + i + " of " + sensorType.wireName() + " frame has no timestamp");
            }
        }
        return new SensorFrame(frameType, sensorType, obj.optString("device_id", ""), frameMillis, sampleTimes);
    }

    private static long secondsToMillis(double seconds) {
        return Math.round(seconds * 1000.0);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> map) {
        map.values().removeIf(v -> v == null);
        return map;
    }
}
