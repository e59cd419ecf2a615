package org.nowstart.stratagem.pipeline.collaborator;

import org.nowstart.stratagem.strategy.StrategySpec;

public interface StrategyTranslator {

    StrategySpec translate(String userText, String model);
}
