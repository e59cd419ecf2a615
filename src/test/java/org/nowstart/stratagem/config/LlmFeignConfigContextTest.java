package org.nowstart.stratagem.config;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import org.junit.jupiter.api.Test;
import org.nowstart.stratagem.data.property.PipelineProperties;
import org.nowstart.stratagem.pipeline.PipelineTestFixtures;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class LlmFeignConfigContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(LlmFeignConfig.class, PipelinePropsTestConfig.class);

    @Test
    void contextLoadsWithLlmFeignConfig() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(RequestInterceptor.class);
        });
    }

    @Test
    void marketDataInterceptor_setsBrowserLikeHeadersOnly() {
        RequestTemplate template = new RequestTemplate();

        new MarketDataFeignConfig().marketDataRequestInterceptor().apply(template);

        assertThat(template.headers()).containsKeys("Accept", "User-Agent").doesNotContainKey("Authorization");
    }

    @Configuration(proxyBeanMethods = false)
    static class PipelinePropsTestConfig {

        @Bean
        PipelineProperties pipelineProperties() {
            return PipelineTestFixtures.properties(true);
        }
    }
}
