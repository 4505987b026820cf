package com.phillippitts.linkband.service.monitor;

public enum AlertLevel {
    WARNING,
    CRITICAL
}
