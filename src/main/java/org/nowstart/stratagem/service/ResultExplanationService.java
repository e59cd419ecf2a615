package org.nowstart.stratagem.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.stratagem.data.dto.ChatMessage;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.nowstart.stratagem.data.type.LlmTask;
import org.nowstart.stratagem.pipeline.collaborator.ResultExplainer;
import org.nowstart.stratagem.strategy.BacktestMetrics;
import org.nowstart.stratagem.strategy.StrategyJson;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ResultExplanationService implements ResultExplainer {

    private final LlmChatService llmChatService;

    @Override
    public String explain(StrategySpec spec, BacktestMetrics metrics, String model) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("strategy_spec", spec);
        input.put("metrics", metrics);

        String inputJson;
        try {
            inputJson = StrategyJson.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Backtest results cannot be rendered", e);
        }

        return llmChatService.complete(
                LlmTask.EXPLANATION,
                model,
                List.of(
                        ChatMessage.system(LlmPrompts.EXPLANATION_SYSTEM),
                        ChatMessage.user(inputJson)
                ),
                false
        );
    }
}
