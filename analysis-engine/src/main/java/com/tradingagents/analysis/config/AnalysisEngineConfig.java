package com.tradingagents.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.cache.TtlCache;
import com.tradingagents.analysis.data.DataProviderClient;
import com.tradingagents.analysis.data.HttpDataProviderClient;
import com.tradingagents.analysis.llm.AnthropicLlmClient;
import com.tradingagents.analysis.llm.LlmClient;
import com.tradingagents.analysis.resilience.ResilienceExecutor;
import com.tradingagents.analysis.resilience.ResiliencePolicy;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Outbound collaborators for stage bodies: the data-provider client, the LLM client,
 * and the cache and resilience settings they share.
 */
@Configuration
public class AnalysisEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngineConfig.class);

    @Value("${services.data-provider.base-url:http://localhost:8090}")
    private String dataProviderBaseUrl;

    @Value("${llm.anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${llm.anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${llm.quick-model:}")
    private String quickModel;

    @Value("${llm.deep-model:}")
    private String deepModel;

    @Value("${llm.max-tokens:2048}")
    private int maxTokens;

    @Value("${cache.data.ttl-minutes:15}")
    private long dataTtlMinutes;

    @Value("${cache.data.maximum-size:500}")
    private long dataCacheMaximumSize;

    @Value("${resilience.llm.max-attempts:3}")
    private int llmMaxAttempts;

    @Value("${resilience.llm.wait-duration-ms:1000}")
    private long llmWaitMs;

    @Value("${resilience.llm.failure-rate-threshold:50}")
    private float llmFailureRate;

    @Value("${resilience.llm.open-state-wait-seconds:120}")
    private long llmOpenStateWaitSeconds;

    // ── WebClients ────────────────────────────────────────────────────────────

    @Bean
    public WebClient dataProviderWebClient(WebClient.Builder builder) {
        return builder
            .baseUrl(dataProviderBaseUrl)
            .clientConnector(connector(15))
            .filter(serverErrorFilter("Data provider"))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient anthropicWebClient(WebClient.Builder builder) {
        return builder
            .baseUrl(anthropicBaseUrl)
            .clientConnector(connector(60))
            .filter(serverErrorFilter("LLM"))
            .filter(loggingFilter())
            .build();
    }

    // ── Collaborators ─────────────────────────────────────────────────────────

    @Bean
    public TtlCache dataCache() {
        return new TtlCache(dataCacheMaximumSize);
    }

    @Bean
    public ResiliencePolicy llmResiliencePolicy() {
        ResiliencePolicy defaults = ResiliencePolicy.llmDefaults();
        return new ResiliencePolicy(llmMaxAttempts, Duration.ofMillis(llmWaitMs), llmFailureRate,
            Duration.ofSeconds(llmOpenStateWaitSeconds), defaults.timeout());
    }

    @Bean
    public DataProviderClient dataProviderClient(@Qualifier("dataProviderWebClient") WebClient webClient,
                                                 ObjectMapper objectMapper, TtlCache dataCache,
                                                 ResilienceExecutor resilience) {
        return new HttpDataProviderClient(webClient, objectMapper, dataCache, resilience,
            ResiliencePolicy.dataDefaults(), dataTtlMinutes);
    }

    @Bean
    public LlmClient llmClient(@Qualifier("anthropicWebClient") WebClient webClient,
                               ObjectMapper objectMapper, ResilienceExecutor resilience,
                               @Qualifier("llmResiliencePolicy") ResiliencePolicy llmResiliencePolicy) {
        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            log.warn("llm.anthropic.api-key is not set. Every LLM-backed stage will fail and degrade.");
        }
        return new AnthropicLlmClient(webClient, objectMapper, resilience, llmResiliencePolicy,
            anthropicApiKey, quickModel, deepModel, maxTokens);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static ReactorClientHttpConnector connector(int readTimeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );
        return new ReactorClientHttpConnector(httpClient);
    }

    private static ExchangeFilterFunction serverErrorFilter(String upstream) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new RuntimeException(upstream + " server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
