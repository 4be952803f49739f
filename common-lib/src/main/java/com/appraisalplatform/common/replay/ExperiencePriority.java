package com.appraisalplatform.common.replay;

import com.appraisalplatform.common.message.MessagePriority;
import com.appraisalplatform.common.message.MessageType;

/**
 * Replay priority of one interaction, in [0, 1].
 *
 * <p>Base by message priority (LOW 0.2, NORMAL 0.5, HIGH 0.7), plus 0.2 for ERROR
 * messages, 0.1 for COMMAND, 0.3 for a failed interaction and 0.1 when the message
 * required acknowledgment.
 */
public final class ExperiencePriority {

    private ExperiencePriority() {}

    public static double score(MessagePriority priority, MessageType type,
                               boolean success, boolean requiresAcknowledgment) {
        double score = switch (priority == null ? MessagePriority.NORMAL : priority) {
            case LOW -> 0.2;
            case NORMAL -> 0.5;
            case HIGH -> 0.7;
        };
        if (type == MessageType.ERROR) {
            score += 0.2;
        } else if (type == MessageType.COMMAND) {
            score += 0.1;
        }
        if (!success) {
            score += 0.3;
        }
        if (requiresAcknowledgment) {
            score += 0.1;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
