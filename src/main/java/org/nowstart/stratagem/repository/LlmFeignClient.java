package org.nowstart.stratagem.repository;

import org.nowstart.stratagem.config.LlmFeignConfig;
import org.nowstart.stratagem.data.dto.ChatCompletionRequest;
import org.nowstart.stratagem.data.dto.ChatCompletionResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "llmClient",
        url = "${stratagem.pipeline.llm-base-url}",
        configuration = LlmFeignConfig.class
)
public interface LlmFeignClient {

    @PostMapping(value = "/v1/chat/completions", consumes = "application/json")
    ChatCompletionResponse createChatCompletion(@RequestBody ChatCompletionRequest request);
}
