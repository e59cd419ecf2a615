package org.nowstart.stratagem.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestTemplate;
import org.junit.jupiter.api.Test;

class LlmAuthRequestInterceptorTest {

    @Test
    void apply_addsBearerTokenAndDefaultHeaders() {
        LlmAuthRequestInterceptor interceptor = new LlmAuthRequestInterceptor(" sk-test ");
        RequestTemplate template = new RequestTemplate();
        template.method("POST");
        template.uri("/chat/completions");

        interceptor.apply(template);

        assertThat(headerValue(template, "Authorization")).isEqualTo("Bearer sk-test");
        assertThat(headerValue(template, "Accept")).isEqualTo("application/json");
        assertThat(headerValue(template, "User-Agent")).isEqualTo("stratagem/1.0");
    }

    @Test
    void apply_skipsAuthorizationWhenKeyBlank() {
        RequestTemplate template = new RequestTemplate();

        new LlmAuthRequestInterceptor("  ").apply(template);
        new LlmAuthRequestInterceptor(null).apply(template);

        assertThat(template.headers()).doesNotContainKey("Authorization");
        assertThat(headerValue(template, "Accept")).isEqualTo("application/json");
    }

    private String headerValue(RequestTemplate template, String key) {
        return template.headers().get(key).iterator().next();
    }
}
