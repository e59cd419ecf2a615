package org.nowstart.stratagem.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final BuildProperties buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("stratagem API")
                        .description("자연어 매매 전략을 백테스트 결과로 바꾸는 파이프라인 세션 API입니다. "
                                + "해석 단계 이후에는 사용자 확인을 받아야 다음 단계로 진행합니다.")
                        .version(buildProperties.getVersion()));
    }
}
