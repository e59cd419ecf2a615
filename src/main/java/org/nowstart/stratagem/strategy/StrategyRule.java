package org.nowstart.stratagem.strategy;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CrossoverRule.class, name = "crossover"),
        @JsonSubTypes.Type(value = VolFilterRule.class, name = "vol_filter")
})
public interface StrategyRule {

    Integer lookaheadDays();

    Integer durationDays();
}
