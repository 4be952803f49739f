package com.appraisalplatform.common.agent;

/**
 * UNINITIALIZED -> INITIALIZED -> (PROCESSING <-> IDLE) -> [UNHEALTHY -> IDLE] ... -> SHUTDOWN
 */
public enum AgentLifecycleState {
    UNINITIALIZED,
    INITIALIZED,
    PROCESSING,
    IDLE,
    UNHEALTHY,
    SHUTDOWN
}
