package org.nowstart.stratagem.data.type;

public enum NodeExecutionState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    SOFT_FAILED,
    HARD_FAILED
}
