package org.nowstart.stratagem.data.type;

public enum LlmTask {
    TRANSLATION,
    INTERPRETATION,
    EXPLANATION
}
