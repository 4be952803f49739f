package com.appraisalplatform.common.event;

public enum EventType {
    INFO,
    WARNING,
    ERROR
}
