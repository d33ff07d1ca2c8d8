package com.tradingagents.analysis.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.resilience.ResilienceExecutor;
import com.tradingagents.analysis.resilience.ResiliencePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link LlmClient} over the Anthropic Messages API.
 *
 * <p>Fully non-blocking: the HTTP call is a {@code Mono} wrapped in the resilience executor
 * under the name {@code "llm"}. With no API key configured every call fails fast with
 * {@link LlmUnavailableException}; the calling stage fails and the orchestrator excludes it.
 */
public class AnthropicLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLlmClient.class);
    private static final String RESILIENCE_NAME = "llm";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final ResilienceExecutor resilience;
    private final ResiliencePolicy policy;
    private final String apiKey;
    private final String quickModel;
    private final String deepModel;
    private final int maxTokens;

    public AnthropicLlmClient(WebClient anthropicClient, ObjectMapper objectMapper,
                              ResilienceExecutor resilience, ResiliencePolicy policy,
                              String apiKey, String quickModel, String deepModel, int maxTokens) {
        this.anthropicClient = anthropicClient;
        this.objectMapper    = objectMapper;
        this.resilience      = resilience;
        this.policy          = policy;
        this.apiKey          = apiKey;
        this.quickModel      = quickModel;
        this.deepModel       = deepModel;
        this.maxTokens       = maxTokens;
    }

    @Override
    public Mono<String> invoke(String systemPrompt, String userPrompt, ModelTier tier) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new LlmUnavailableException("No Anthropic API key configured"));
        }
        String model = ModelSelector.selectModel(tier, quickModel, deepModel);

        return resilience.withResilience(RESILIENCE_NAME, () -> call(systemPrompt, userPrompt, model), policy)
            .doOnSuccess(text -> log.debug("[LLM] Completion received. model={} chars={}",
                model, text != null ? text.length() : 0));
    }

    private Mono<String> call(String systemPrompt, String userPrompt, String model) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "system", systemPrompt,
            "messages", List.of(Map.of("role", "user", "content", userPrompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson -> anthropicClient.post()
                .uri("/v1/messages")
                .header("x-api-key", apiKey)
                .bodyValue(bodyJson)
                .retrieve()
                .bodyToMono(String.class))
            .map(this::extractText);
    }

    String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            String text = root.path("content").path(0).path("text").asText("");
            if (text.isBlank()) {
                throw new LlmUnavailableException("Empty completion from Anthropic");
            }
            return text.trim();
        } catch (LlmUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new LlmUnavailableException("Failed to extract text from Anthropic response", e);
        }
    }
}
