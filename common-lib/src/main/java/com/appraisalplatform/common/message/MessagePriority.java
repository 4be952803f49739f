package com.appraisalplatform.common.message;

public enum MessagePriority {
    LOW(1),
    NORMAL(2),
    HIGH(3);

    private final int rank;

    MessagePriority(int rank) {
        this.rank = rank;
    }

    public boolean isAtLeast(MessagePriority other) {
        return rank >= other.rank;
    }
}
