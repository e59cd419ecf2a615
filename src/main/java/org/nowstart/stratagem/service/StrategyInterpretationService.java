package org.nowstart.stratagem.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.stratagem.data.dto.ChatMessage;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.nowstart.stratagem.data.type.LlmTask;
import org.nowstart.stratagem.pipeline.collaborator.StrategyInterpreter;
import org.nowstart.stratagem.strategy.StrategyJson;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyInterpretationService implements StrategyInterpreter {

    private final LlmChatService llmChatService;

    @Override
    public String interpret(String userText, StrategySpec spec, String model) {
        String specJson;
        try {
            specJson = StrategyJson.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(spec);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Strategy specification cannot be rendered", e);
        }

        return llmChatService.complete(
                LlmTask.INTERPRETATION,
                model,
                List.of(
                        ChatMessage.system(LlmPrompts.INTERPRETATION_SYSTEM),
                        ChatMessage.user(String.format(LlmPrompts.INTERPRETATION_USER, userText, specJson))
                ),
                false
        );
    }
}
