package org.nowstart.stratagem.config;

import feign.RequestInterceptor;
import org.nowstart.stratagem.data.property.PipelineProperties;
import org.nowstart.stratagem.service.auth.LlmAuthRequestInterceptor;
import org.springframework.context.annotation.Bean;

// registered only through LlmFeignClient so the bearer header never reaches other clients
public class LlmFeignConfig {

    @Bean
    public RequestInterceptor llmAuthRequestInterceptor(PipelineProperties pipelineProperties) {
        return new LlmAuthRequestInterceptor(pipelineProperties.llmApiKey());
    }
}
