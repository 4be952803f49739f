package com.appraisalplatform.common.agent;

public enum IssueSeverity {
    LOW,
    MEDIUM,
    HIGH
}
