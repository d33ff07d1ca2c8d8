package com.tradingagents.analysis.llm;

import reactor.core.publisher.Mono;

/** Text-in, text-out LLM invocation. Implementations own retries and timeouts. */
public interface LlmClient {

    Mono<String> invoke(String systemPrompt, String userPrompt, ModelTier tier);
}
