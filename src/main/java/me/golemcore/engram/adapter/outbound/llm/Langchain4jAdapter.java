package me.golemcore.engram.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.domain.model.LlmRequest;
import me.golemcore.engram.domain.model.LlmResponse;
import me.golemcore.engram.domain.model.LlmUsage;
import me.golemcore.engram.domain.model.Message;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint via
 * {@code engram.llm.langchain4j.base-url}) and Anthropic models. Rate-limit
 * errors are retried with exponential backoff; everything else fails the
 * returned future.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int ANTHROPIC_MAX_TOKENS = 1024;
    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final EngramProperties properties;

    private ChatModel chatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized)
            return;

        EngramProperties.Langchain4jProperties config = properties.getLlm().getLangchain4j();
        this.currentModel = config.getModel();
        try {
            this.chatModel = createModel(config);
            initialized = true;
            log.info("[LLM] Langchain4j adapter initialized with {} model: {}", config.getProvider(),
                    config.getModel());
        } catch (RuntimeException e) {
            log.warn("[LLM] Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private ChatModel createModel(EngramProperties.Langchain4jProperties config) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("engram.llm.langchain4j.api-key is not configured");
        }
        if (PROVIDER_ANTHROPIC.equals(config.getProvider())) {
            return createAnthropicModel(config);
        }
        // All non-Anthropic providers use OpenAI-compatible API
        return createOpenAiModel(config);
    }

    private ChatModel createAnthropicModel(EngramProperties.Langchain4jProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(ANTHROPIC_MAX_TOKENS)
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(EngramProperties.Langchain4jProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    /**
     * Runs the call with rate-limit retries on the common pool. Cancelling the
     * returned future stops further attempts and backoff waits; an HTTP call
     * already in flight is bounded by {@code engram.llm.langchain4j.timeout}.
     */
    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        CompletableFuture<LlmResponse> result = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> {
            try {
                result.complete(chatWithRetries(request, result));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private LlmResponse chatWithRetries(LlmRequest request, CompletableFuture<LlmResponse> result) {
        ensureInitialized();
        if (chatModel == null) {
            throw new IllegalStateException("Langchain4j adapter not available");
        }

        ChatRequest chatRequest = buildChatRequest(request);
        int maxRetries = Math.max(0, properties.getLlm().getLangchain4j().getMaxRetries());

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (result.isDone()) {
                log.debug("[LLM] Caller gave up, skipping attempt {}", attempt + 1);
                throw new CancellationException("LLM chat abandoned by caller");
            }
            try {
                return convertResponse(chatModel.chat(chatRequest));
            } catch (RuntimeException e) {
                if (!isRateLimitError(e) || attempt >= maxRetries) {
                    log.warn("[LLM] Chat failed: {}", e.getMessage());
                    throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                }
                long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                        attempt + 1, maxRetries, backoffMs);
                sleep(backoffMs);
            }
        }
        throw new IllegalStateException("LLM chat failed: max retries exhausted");
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", e);
        }
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    ChatRequest buildChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request))
                .temperature(request.getTemperature());
        if (request.getMaxTokens() != null) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            if (!msg.hasContent()) {
                continue;
            }
            switch (msg.getRole()) {
            case "assistant" -> messages.add(AiMessage.from(msg.getContent()));
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            default -> {
                log.debug("[LLM] Role {} sent as user message", msg.getRole());
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(nullToZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(nullToZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(nullToZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .usage(usage)
                .model(currentModel)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private int nullToZero(Integer value) {
        return value != null ? value : 0;
    }

    @Override
    public String getCurrentModel() {
        return currentModel != null ? currentModel : properties.getLlm().getLangchain4j().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getLangchain4j().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }
}
