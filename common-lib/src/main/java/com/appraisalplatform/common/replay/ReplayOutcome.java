package com.appraisalplatform.common.replay;

public enum ReplayOutcome {
    SUCCESS,
    FAILURE
}
