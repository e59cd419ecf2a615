package org.nowstart.stratagem.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "stratagem.pipeline")
public record PipelineProperties(
        // 요청에 모델이 없을 때 사용할 기본 LLM 모델
        @NotBlank @DefaultValue("gpt-4o-mini") String defaultModel,
        // OpenAI 호환 chat completions API 기본 URL
        @NotBlank @DefaultValue("https://api.openai.com") String llmBaseUrl,
        // LLM API Key (Bearer 인증)
        @DefaultValue("") String llmApiKey,
        // 일봉 시세 조회 API 기본 URL
        @NotBlank @DefaultValue("https://query1.finance.yahoo.com") String marketDataBaseUrl,
        // LLM 호출 최대 시도 횟수(최초 호출 포함)
        @Positive @DefaultValue("3") int llmMaxAttempts,
        // 시세 조회 최대 시도 횟수(최초 호출 포함)
        @Positive @DefaultValue("3") int dataMaxAttempts,
        // 재시도 첫 대기 시간(이후 2배씩 증가)
        @NotNull @DefaultValue("1s") Duration retryBaseDelay,
        // 재시도 대기 시간 상한
        @NotNull @DefaultValue("4s") Duration retryMaxDelay,
        // 마지막 갱신 후 체크포인트 보관 기간
        @NotNull @DefaultValue("24h") Duration checkpointTtl,
        // 만료 체크포인트 정리 주기
        @NotNull @DefaultValue("5m") Duration checkpointEvictionInterval,
        // 노드 완료마다 체크포인트 저장 여부(크래시 복구용)
        @DefaultValue("false") boolean checkpointEveryNode
) {
}
