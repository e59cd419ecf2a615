package org.nowstart.stratagem.pipeline.collaborator;

import org.nowstart.stratagem.strategy.StrategySpec;

public interface StrategyInterpreter {

    /**
     * Plain-language account of how {@code spec} was read from {@code userText}, shown before the user confirms.
     */
    String interpret(String userText, StrategySpec spec, String model);
}
