package org.nowstart.stratagem.config;

import java.time.Clock;
import org.nowstart.stratagem.pipeline.PipelineRouter;
import org.nowstart.stratagem.pipeline.PipelineRoutes;
import org.nowstart.stratagem.pipeline.RetryExecutor;
import org.nowstart.stratagem.pipeline.Sleeper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    public PipelineRouter pipelineRouter() {
        return PipelineRoutes.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public RetryExecutor retryExecutor(Sleeper sleeper) {
        return new RetryExecutor(sleeper);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
