package org.nowstart.stratagem.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import lombok.RequiredArgsConstructor;

/**
 * Bearer authentication for the chat-completions API. Requests go out unauthenticated when no key is configured.
 */
@RequiredArgsConstructor
public class LlmAuthRequestInterceptor implements RequestInterceptor {

    private final String apiKey;

    @Override
    public void apply(RequestTemplate template) {
        if (apiKey != null && !apiKey.isBlank()) {
            template.header("Authorization", "Bearer " + apiKey.trim());
        }
        template.header("Accept", "application/json");
        template.header("User-Agent", "stratagem/1.0");
    }
}
