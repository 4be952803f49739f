package com.appraisalplatform.common.event;

public enum EventSeverity {
    LOW,
    MEDIUM,
    HIGH,
    ERROR
}
