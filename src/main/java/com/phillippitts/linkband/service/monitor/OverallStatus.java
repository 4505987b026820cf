package com.phillippitts.linkband.service.monitor;

/**
 * Categorical health of the bridge link.
 *
 * <pre>
 * websocket | api   | streaming | overall
 * true      | true  | true      | HEALTHY
 * true      | true  | false     | READY
 * exactly one true  | any       | DEGRADED
 * false     | false | any       | OFFLINE
 * </pre>
 */
public enum OverallStatus {
    HEALTHY,
    READY,
    DEGRADED,
    OFFLINE;

    /** The only way to derive an overall status. */
    public static OverallStatus of(boolean websocket, boolean api, boolean streaming) {
        if (websocket && api) {
            return streaming ? HEALTHY : READY;
        }
        if (websocket || api) {
            return DEGRADED;
        }
        return OFFLINE;
    }

    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
