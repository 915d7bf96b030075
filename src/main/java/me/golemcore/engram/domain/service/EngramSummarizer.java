package me.golemcore.engram.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.domain.model.LlmRequest;
import me.golemcore.engram.domain.model.LlmResponse;
import me.golemcore.engram.domain.model.Message;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Turns a batch of buffered messages into an engram digest using the LLM as a
 * summarization oracle. Long inputs are truncated per message and only the
 * most recent messages are submitted. Every failure (unavailable model,
 * timeout, error, empty answer) yields {@code null}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngramSummarizer {

    /** Upper bound of a stored digest, in estimated tokens. */
    static final int MAX_CONTENT_TOKENS = 500;

    private static final String SYSTEM_PROMPT = """
            You are a memory consolidation system. Create a concise summary that captures:
            1. The main topic(s) discussed
            2. Key decisions made or conclusions reached
            3. Important technical details (errors, solutions, code snippets)
            4. Emotional tone or user preferences expressed
            5. Any unresolved questions or next steps

            Be specific and factual. This summary will be used to maintain context in future conversations.""";

    private final LlmPort llmPort;
    private final EngramProperties properties;
    private final TokenEstimator tokenEstimator;
    private final Clock clock;

    /**
     * Summarize a list of messages into a single digest.
     *
     * @return digest text, or null if the LLM is unavailable or fails
     */
    public String summarize(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return null;
        }

        if (llmPort == null || !llmPort.isAvailable()) {
            log.warn("[Summarizer] LLM not available, cannot summarize");
            return null;
        }

        String conversation = formatConversation(messages);
        if (conversation.isEmpty()) {
            log.warn("[Summarizer] No message content to summarize");
            return null;
        }

        EngramProperties.SummarizerProperties config = properties.getSummarizer();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .messages(List.of(Message.builder()
                        .role("user")
                        .content("Summarize this conversation segment into a memory engram (max 200 words):\n\n"
                                + conversation + "\n\nSUMMARY:")
                        .timestamp(clock.instant())
                        .build()))
                .maxTokens(config.getMaxSummaryTokens())
                .temperature(config.getTemperature())
                .build();

        long start = clock.millis();
        CompletableFuture<LlmResponse> pending = llmPort.chat(request);
        try {
            LlmResponse response = pending.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = clock.millis() - start;

            String summary = response != null ? response.getContent() : null;
            if (summary == null || summary.isBlank()) {
                log.warn("[Summarizer] LLM returned empty summary");
                return null;
            }
            summary = capLength(summary.strip());
            log.debug("[Summarizer] Summarized {} messages in {}ms ({} chars)",
                    messages.size(), elapsed, summary.length());
            return summary;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            log.warn("[Summarizer] LLM summarization interrupted: {}", e.getMessage());
            return null;
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.warn("[Summarizer] LLM summarization timed out after {}", config.getTimeout());
            return null;
        } catch (ExecutionException e) {
            log.warn("[Summarizer] LLM summarization failed: {}", e.getMessage());
            return null;
        }
    }

    String formatConversation(List<Message> messages) {
        EngramProperties.SummarizerProperties config = properties.getSummarizer();
        List<String> lines = messages.stream()
                .filter(Message::hasContent)
                .map(m -> roleLabel(m) + ": " + truncate(m.getContent(), config.getMaxMessageChars()))
                .toList();
        int from = Math.max(0, lines.size() - config.getMaxMessages());
        return lines.subList(from, lines.size()).stream().collect(Collectors.joining("\n\n"));
    }

    private String capLength(String summary) {
        if (tokenEstimator.estimate(summary) <= MAX_CONTENT_TOKENS) {
            return summary;
        }
        int maxChars = (int) (MAX_CONTENT_TOKENS * properties.getConsolidation().getCharsPerToken());
        return truncate(summary, maxChars);
    }

    private String roleLabel(Message message) {
        return message.getRole() != null ? message.getRole().toUpperCase(Locale.ROOT) : "UNKNOWN";
    }

    private String truncate(String text, int maxLen) {
        if (text == null)
            return "";
        if (text.length() <= maxLen)
            return text;
        return text.substring(0, maxLen) + "...";
    }
}
