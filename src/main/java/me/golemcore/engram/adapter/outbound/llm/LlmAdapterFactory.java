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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.domain.model.LlmRequest;
import me.golemcore.engram.domain.model.LlmResponse;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The {@link LlmPort} the summarizer sees. Delegates to the provider adapter
 * named by {@code engram.llm.provider}:
 * <ul>
 * <li>langchain4j - OpenAI, Anthropic or any OpenAI-compatible endpoint
 * <li>none - summarization always fails, so no engram is ever created
 * </ul>
 * An unknown provider falls back to {@code none}, or to the first registered
 * adapter when that is missing too.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final EngramProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private LlmProviderAdapter delegate;

    @PostConstruct
    public void init() {
        String configured = properties.getLlm().getProvider();
        delegate = find(configured);
        if (delegate != null) {
            delegate.initialize();
            log.info("[LLM] Summarization provider: {} ({})", configured, delegate.getCurrentModel());
            return;
        }

        delegate = find(PROVIDER_NONE);
        if (delegate == null && !adapters.isEmpty()) {
            delegate = adapters.get(0);
        }
        log.warn("[LLM] Provider '{}' is not registered, summarization uses: {}", configured, getProviderId());
    }

    private LlmProviderAdapter find(String providerId) {
        return adapters.stream()
                .filter(adapter -> adapter.getProviderId().equals(providerId))
                .findFirst()
                .orElse(null);
    }

    @Override
    public String getProviderId() {
        return delegate != null ? delegate.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (delegate == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter registered"));
        }
        return delegate.chat(request);
    }

    @Override
    public String getCurrentModel() {
        return delegate != null ? delegate.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return delegate != null && delegate.isAvailable();
    }
}
