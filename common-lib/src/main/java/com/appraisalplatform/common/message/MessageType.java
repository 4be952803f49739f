package com.appraisalplatform.common.message;

public enum MessageType {
    QUERY,
    COMMAND,
    EVENT,
    RESPONSE,
    BROADCAST,
    NOTIFICATION,
    ERROR,
    STATUS_UPDATE
}
