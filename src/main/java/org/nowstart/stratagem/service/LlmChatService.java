package org.nowstart.stratagem.service;

import feign.FeignException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.dto.ChatCompletionRequest;
import org.nowstart.stratagem.data.dto.ChatCompletionResponse;
import org.nowstart.stratagem.data.dto.ChatMessage;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.nowstart.stratagem.data.exception.PipelineException;
import org.nowstart.stratagem.data.type.LlmTask;
import org.nowstart.stratagem.repository.LlmFeignClient;
import org.springframework.stereotype.Service;

/**
 * Single chat-completion call with usage logging. Upstream failures come back as pipeline exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmChatService {

    private final LlmFeignClient llmFeignClient;
    private final LlmUsageLogService llmUsageLogService;

    public String complete(LlmTask task, String model, List<ChatMessage> messages, boolean jsonMode) {
        ChatCompletionRequest request = new ChatCompletionRequest(
                model,
                messages,
                jsonMode ? 0.0 : null,
                jsonMode ? ChatCompletionRequest.ResponseFormat.jsonObject() : null
        );

        long startedAt = System.nanoTime();
        ChatCompletionResponse response;
        try {
            response = llmFeignClient.createChatCompletion(request);
        } catch (FeignException e) {
            PipelineException classified = FeignErrors.classify("LLM", e);
            llmUsageLogService.logCall(task, model, null, elapsedMillis(startedAt), false, classified.getMessage());
            throw classified;
        }

        String content = extractContent(response);
        if (content == null) {
            llmUsageLogService.logCall(task, model, response == null ? null : response.usage(),
                    elapsedMillis(startedAt), false, "empty completion");
            throw new InvalidInputException("Model returned an empty response for " + task);
        }

        llmUsageLogService.logCall(task, model, response.usage(), elapsedMillis(startedAt), true, null);
        return content;
    }

    private String extractContent(ChatCompletionResponse response) {
        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            return null;
        }
        ChatCompletionResponse.Choice choice = response.choices().get(0);
        if (choice == null || choice.message() == null || choice.message().content() == null
                || choice.message().content().isBlank()) {
            return null;
        }
        return choice.message().content().trim();
    }

    private long elapsedMillis(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000L;
    }
}
