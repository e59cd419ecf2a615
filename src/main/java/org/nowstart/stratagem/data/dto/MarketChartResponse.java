package org.nowstart.stratagem.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MarketChartResponse(Chart chart) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chart(List<Result> result, ChartError error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChartError(String code, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(Meta meta, List<Long> timestamp, Indicators indicators) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(String symbol, String currency, String exchangeTimezoneName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Indicators(List<Quote> quote, List<AdjClose> adjclose) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Quote(List<Double> open, List<Double> high, List<Double> low, List<Double> close, List<Long> volume) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AdjClose(List<Double> adjclose) {
    }
}
