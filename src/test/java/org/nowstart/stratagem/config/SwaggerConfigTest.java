package org.nowstart.stratagem.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.info.BuildProperties;

class SwaggerConfigTest {

    @Test
    void customOpenAPI_describesPipelineSessionsWithBuildVersion() {
        Properties properties = new Properties();
        properties.setProperty("artifact", "stratagem");
        properties.setProperty("version", "0.1.0");
        SwaggerConfig config = new SwaggerConfig(new BuildProperties(properties));

        var info = config.customOpenAPI().getInfo();

        assertThat(info.getTitle()).isEqualTo("stratagem API");
        assertThat(info.getDescription()).contains("백테스트", "사용자 확인");
        assertThat(info.getVersion()).isEqualTo("0.1.0");
    }
}
