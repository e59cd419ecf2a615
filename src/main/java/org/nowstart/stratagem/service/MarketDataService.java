package org.nowstart.stratagem.service;

import feign.FeignException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.dto.MarketChartResponse;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.nowstart.stratagem.pipeline.collaborator.PriceDataSource;
import org.nowstart.stratagem.repository.MarketDataFeignClient;
import org.nowstart.stratagem.strategy.DateRange;
import org.nowstart.stratagem.strategy.PriceBar;
import org.nowstart.stratagem.strategy.PriceSeries;
import org.springframework.stereotype.Service;

/**
 * Daily bars from a chart endpoint. Closes are split/dividend adjusted when the upstream provides adjusted values.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataService implements PriceDataSource {

    private static final String DAILY_INTERVAL = "1d";
    private static final String EVENTS = "history";

    private final MarketDataFeignClient marketDataFeignClient;

    @Override
    public PriceSeries fetch(String ticker, DateRange range) {
        String symbol = normalizeTicker(ticker);
        if (symbol.isBlank()) {
            throw new InvalidInputException("Ticker is required");
        }

        MarketChartResponse response;
        try {
            response = marketDataFeignClient.getChart(
                    symbol,
                    range.start().atStartOfDay(ZoneOffset.UTC).toEpochSecond(),
                    range.end().atStartOfDay(ZoneOffset.UTC).toEpochSecond(),
                    DAILY_INTERVAL,
                    EVENTS
            );
        } catch (FeignException.NotFound e) {
            throw new InvalidInputException("Unknown ticker " + symbol, e);
        } catch (FeignException e) {
            throw FeignErrors.classify("Market data", e);
        }

        List<PriceBar> bars = toBars(symbol, response, range);
        if (bars.isEmpty()) {
            log.warn("No daily bars after normalization. ticker={} start={} end={}", symbol, range.start(), range.end());
            throw new InvalidInputException("No price data returned for " + symbol + ".");
        }
        return new PriceSeries(symbol, bars);
    }

    public String normalizeTicker(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }

    private List<PriceBar> toBars(String symbol, MarketChartResponse response, DateRange range) {
        MarketChartResponse.Chart chart = response == null ? null : response.chart();
        if (chart == null || chart.result() == null || chart.result().isEmpty()) {
            if (chart != null && chart.error() != null) {
                throw new InvalidInputException("Market data error for " + symbol + ": " + chart.error().description());
            }
            return List.of();
        }

        MarketChartResponse.Result result = chart.result().get(0);
        if (result == null || result.timestamp() == null || result.indicators() == null
                || result.indicators().quote() == null || result.indicators().quote().isEmpty()) {
            return List.of();
        }

        ZoneId zone = resolveZone(result.meta());
        MarketChartResponse.Quote quote = result.indicators().quote().get(0);
        List<Double> adjusted = adjustedCloses(result.indicators());

        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < result.timestamp().size(); i++) {
            Long timestamp = result.timestamp().get(i);
            Double open = valueAt(quote.open(), i);
            Double high = valueAt(quote.high(), i);
            Double low = valueAt(quote.low(), i);
            Double close = valueAt(quote.close(), i);
            if (timestamp == null || open == null || high == null || low == null || close == null) {
                continue;
            }

            LocalDate date = Instant.ofEpochSecond(timestamp).atZone(zone).toLocalDate();
            if (date.isBefore(range.start()) || !date.isBefore(range.end())) {
                continue;
            }

            Double adjustedClose = valueAt(adjusted, i);
            Long volume = valueAt(quote.volume(), i);
            bars.add(new PriceBar(
                    date,
                    open,
                    high,
                    low,
                    adjustedClose == null ? close : adjustedClose,
                    volume == null ? 0L : volume
            ));
        }

        bars.sort(Comparator.comparing(PriceBar::date));
        return bars;
    }

    private List<Double> adjustedCloses(MarketChartResponse.Indicators indicators) {
        if (indicators.adjclose() == null || indicators.adjclose().isEmpty() || indicators.adjclose().get(0) == null) {
            return null;
        }
        return indicators.adjclose().get(0).adjclose();
    }

    private ZoneId resolveZone(MarketChartResponse.Meta meta) {
        if (meta == null || meta.exchangeTimezoneName() == null) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(meta.exchangeTimezoneName());
        } catch (DateTimeException e) {
            log.debug("Unknown exchange timezone={}, falling back to UTC", meta.exchangeTimezoneName());
            return ZoneOffset.UTC;
        }
    }

    private static <T> T valueAt(List<T> values, int index) {
        if (values == null || index >= values.size()) {
            return null;
        }
        return values.get(index);
    }
}
