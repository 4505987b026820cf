package com.phillippitts.linkband.service.monitor;

public enum AlertType {
    /** Link went fully offline. */
    OFFLINE,
    /** Link keeps dropping into DEGRADED. */
    UNSTABLE,
    /** Error rate crossed its threshold. */
    HIGH_ERROR_RATE
}
