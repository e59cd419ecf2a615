package org.nowstart.stratagem.pipeline;

import org.nowstart.stratagem.data.type.NodeName;

/**
 * Payload slots with their single writer. A null owner means the engine writes the slot.
 * Non-persistent slots are rebuilt by re-running their owner after recovery.
 */
public enum PayloadField {
    USER_TEXT(null, true),
    MODEL(null, true),
    CONFIRMED(null, true),
    SPEC(NodeName.TRANSLATE, true),
    INTERPRETATION(NodeName.INTERPRET, true),
    VALIDATION_RESULT(NodeName.VALIDATE, true),
    PRICE_SERIES(NodeName.FETCH_DATA, false),
    FEATURES(NodeName.ADD_FEATURES, false),
    DATA_VALIDATION_RESULT(NodeName.PRE_QA, true),
    BACKTEST_RUN(NodeName.BACKTEST, false),
    METRICS(NodeName.METRICS, true),
    TRADES(NodeName.TRADES, true),
    EXPLANATION(NodeName.EXPLAIN, true);

    private final NodeName owner;
    private final boolean persistent;

    PayloadField(NodeName owner, boolean persistent) {
        this.owner = owner;
        this.persistent = persistent;
    }

    public NodeName owner() {
        return owner;
    }

    public boolean persistent() {
        return persistent;
    }

    public boolean engineOwned() {
        return owner == null;
    }
}
