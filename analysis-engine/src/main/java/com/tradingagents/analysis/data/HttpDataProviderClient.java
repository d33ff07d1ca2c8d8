package com.tradingagents.analysis.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.cache.TtlCache;
import com.tradingagents.analysis.indicator.IndicatorSnapshot;
import com.tradingagents.analysis.resilience.ResilienceExecutor;
import com.tradingagents.analysis.resilience.ResiliencePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DataProviderClient} over the provider's REST API.
 *
 * <pre>
 *   GET /api/v1/data/{kind}?ticker=&amp;date=&amp;lookbackDays=   → text/plain feed
 *   GET /api/v1/data/prices?ticker=&amp;date=&amp;lookbackDays=   → {"closes":[...]} newest-first
 *   GET /api/v1/data/metrics?ticker=&amp;date=                  → {"peRatio":..,"debtToEquity":..,"sectorSentiment":..}
 * </pre>
 *
 * Every call goes through the TTL cache and the resilience executor under the name
 * {@code "data-provider"}.
 */
public class HttpDataProviderClient implements DataProviderClient {

    private static final Logger log = LoggerFactory.getLogger(HttpDataProviderClient.class);
    private static final String RESILIENCE_NAME = "data-provider";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final TtlCache cache;
    private final ResilienceExecutor resilience;
    private final ResiliencePolicy policy;
    private final long ttlMinutes;

    public HttpDataProviderClient(WebClient webClient, ObjectMapper objectMapper, TtlCache cache,
                                  ResilienceExecutor resilience, ResiliencePolicy policy, long ttlMinutes) {
        this.webClient   = webClient;
        this.objectMapper = objectMapper;
        this.cache       = cache;
        this.resilience  = resilience;
        this.policy      = policy;
        this.ttlMinutes  = ttlMinutes;
    }

    @Override
    public Mono<String> fetch(DataRequest request) {
        log.info("Fetching provider data. kind={} ticker={} date={}", request.kind(), request.ticker(), request.tradeDate());
        return cache.get(request.cacheKey(), () -> resilience.withResilience(RESILIENCE_NAME,
            () -> webClient.get()
                .uri(uri -> uri.path("/api/v1/data/" + request.kind().path())
                    .queryParam("ticker", request.ticker())
                    .queryParam("date", request.tradeDate())
                    .queryParam("lookbackDays", request.lookbackDays())
                    .build())
                .retrieve()
                .bodyToMono(String.class),
            policy), ttlMinutes);
    }

    @Override
    public Mono<List<Double>> closingPrices(String ticker, LocalDate tradeDate, int lookbackDays) {
        String key = "prices:" + ticker + ":" + tradeDate + ":" + lookbackDays;
        return cache.get(key, () -> resilience.withResilience(RESILIENCE_NAME,
            () -> webClient.get()
                .uri(uri -> uri.path("/api/v1/data/prices")
                    .queryParam("ticker", ticker)
                    .queryParam("date", tradeDate)
                    .queryParam("lookbackDays", lookbackDays)
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .map(this::parseCloses),
            policy), ttlMinutes);
    }

    @Override
    public Mono<IndicatorSnapshot> indicators(String ticker, LocalDate tradeDate) {
        Mono<IndicatorSnapshot> metrics = cache.get("metrics:" + ticker + ":" + tradeDate,
            () -> resilience.withResilience(RESILIENCE_NAME,
                () -> webClient.get()
                    .uri(uri -> uri.path("/api/v1/data/metrics")
                        .queryParam("ticker", ticker)
                        .queryParam("date", tradeDate)
                        .build())
                    .retrieve()
                    .bodyToMono(String.class)
                    .map(this::parseMetrics),
                policy), ttlMinutes)
            .onErrorResume(e -> {
                log.warn("Metrics unavailable (non-critical). ticker={} reason={}", ticker, e.getMessage());
                return Mono.just(IndicatorSnapshot.empty());
            });

        return closingPrices(ticker, tradeDate, DataKind.PRICE_HISTORY.defaultLookbackDays())
            .map(IndicatorSnapshot::fromCloses)
            .zipWith(metrics, (prices, m) -> prices.withFundamentals(m.sectorSentiment(), m.peRatio(), m.debtToEquity()));
    }

    List<Double> parseCloses(String body) {
        try {
            JsonNode closes = objectMapper.readTree(body).path("closes");
            List<Double> out = new ArrayList<>();
            closes.forEach(n -> out.add(n.asDouble()));
            return out;
        } catch (Exception e) {
            throw new IllegalStateException("Malformed price payload", e);
        }
    }

    IndicatorSnapshot parseMetrics(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            return IndicatorSnapshot.empty().withFundamentals(
                optionalDouble(root, "sectorSentiment"),
                optionalDouble(root, "peRatio"),
                optionalDouble(root, "debtToEquity"));
        } catch (Exception e) {
            throw new IllegalStateException("Malformed metrics payload", e);
        }
    }

    private static Double optionalDouble(JsonNode root, String field) {
        JsonNode node = root.path(field);
        return node.isNumber() ? node.asDouble() : null;
    }
}
