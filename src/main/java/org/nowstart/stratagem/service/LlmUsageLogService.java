package org.nowstart.stratagem.service;

import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.dto.ChatCompletionResponse;
import org.nowstart.stratagem.data.type.LlmTask;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class LlmUsageLogService {

    // USD per 1M tokens: {input, output}
    private static final Map<String, double[]> MODEL_PRICING = Map.of(
            "gpt-4o-mini", new double[]{0.15, 0.60},
            "gpt-4o", new double[]{2.50, 10.0},
            "gpt-4", new double[]{30.0, 60.0},
            "gpt-4-turbo", new double[]{10.0, 30.0},
            "gpt-3.5-turbo", new double[]{0.50, 1.50}
    );

    public void logCall(
            LlmTask task,
            String model,
            ChatCompletionResponse.Usage usage,
            long latencyMs,
            boolean success,
            String errorMessage
    ) {
        int inputTokens = usage == null ? 0 : usage.prompt_tokens();
        int outputTokens = usage == null ? 0 : usage.completion_tokens();
        double cost = estimateCostUsd(model, inputTokens, outputTokens);

        if (success) {
            log.info(
                    "event=llm_call task={} model={} input_tokens={} output_tokens={} cost_usd={} latency_ms={} success=true",
                    task.name().toLowerCase(Locale.ROOT),
                    model,
                    inputTokens,
                    outputTokens,
                    String.format(Locale.ROOT, "%.6f", cost),
                    latencyMs
            );
            return;
        }

        log.warn(
                "event=llm_call task={} model={} input_tokens={} output_tokens={} cost_usd={} latency_ms={} success=false error=\"{}\"",
                task.name().toLowerCase(Locale.ROOT),
                model,
                inputTokens,
                outputTokens,
                String.format(Locale.ROOT, "%.6f", cost),
                latencyMs,
                escape(errorMessage)
        );
    }

    public double estimateCostUsd(String model, int inputTokens, int outputTokens) {
        double[] pricing = model == null ? null : MODEL_PRICING.get(model);
        if (pricing == null) {
            return 0.0;
        }
        return inputTokens / 1_000_000.0 * pricing[0] + outputTokens / 1_000_000.0 * pricing[1];
    }

    private String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\"", "'");
    }
}
