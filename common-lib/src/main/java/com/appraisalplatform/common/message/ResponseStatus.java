package com.appraisalplatform.common.message;

public enum ResponseStatus {
    SUCCESS,
    ERROR,
    WARNING,
    PARTIAL_SUCCESS
}
