package org.nowstart.stratagem.repository;

import org.nowstart.stratagem.config.MarketDataFeignConfig;
import org.nowstart.stratagem.data.dto.MarketChartResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "marketDataClient",
        url = "${stratagem.pipeline.market-data-base-url}",
        configuration = MarketDataFeignConfig.class
)
public interface MarketDataFeignClient {

    @GetMapping("/v8/finance/chart/{ticker}")
    MarketChartResponse getChart(
            @PathVariable("ticker") String ticker,
            @RequestParam("period1") long period1,
            @RequestParam("period2") long period2,
            @RequestParam("interval") String interval,
            @RequestParam("events") String events
    );
}
