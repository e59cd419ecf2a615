package org.nowstart.stratagem.data.type;

public enum SessionStatus {
    RUNNING,
    AWAITING_INPUT,
    FAILED,
    COMPLETED;

    public boolean isTerminal() {
        return this == FAILED || this == COMPLETED;
    }
}
