package org.nowstart.stratagem.service;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.stratagem.data.dto.ChatMessage;
import org.nowstart.stratagem.data.type.LlmTask;
import org.nowstart.stratagem.pipeline.collaborator.StrategyTranslator;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.nowstart.stratagem.strategy.StrategySpecParser;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyTranslationService implements StrategyTranslator {

    private final LlmChatService llmChatService;
    private final StrategySpecParser strategySpecParser;

    @Override
    public StrategySpec translate(String userText, String model) {
        String json = llmChatService.complete(
                LlmTask.TRANSLATION,
                model,
                List.of(
                        ChatMessage.system(LlmPrompts.TRANSLATION_SYSTEM),
                        ChatMessage.user(String.format(LlmPrompts.TRANSLATION_USER, userText))
                ),
                true
        );
        return strategySpecParser.parse(json);
    }
}
