package org.nowstart.stratagem.config;

import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;

public class MarketDataFeignConfig {

    @Bean
    public RequestInterceptor marketDataRequestInterceptor() {
        return template -> {
            template.header("Accept", "application/json");
            template.header("User-Agent", "Mozilla/5.0 (compatible; stratagem/1.0)");
        };
    }
}
