package me.golemcore.engram.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the engram engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code engram.*} prefix:
 * <ul>
 * <li>{@link ConsolidationProperties} - buffering and consolidation
 * triggers</li>
 * <li>{@link SummarizerProperties} - summarization oracle limits</li>
 * <li>{@link DecayProperties} - decay and reinforcement</li>
 * <li>{@link RetrievalProperties} - composite ranking weights</li>
 * <li>{@link CleanupProperties} - maintenance sweep</li>
 * <li>{@link StorageProperties} - engram persistence</li>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * </ul>
 *
 * <p>
 * Values are checked once at startup by {@link EngramPropertiesValidator};
 * invalid thresholds abort startup.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "engram")
@Data
public class EngramProperties {

    /** Master feature flag. When false no engrams are created or retrieved. */
    private boolean enabled = true;

    private ConsolidationProperties consolidation = new ConsolidationProperties();
    private SummarizerProperties summarizer = new SummarizerProperties();
    private DecayProperties decay = new DecayProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private CleanupProperties cleanup = new CleanupProperties();
    private StorageProperties storage = new StorageProperties();
    private LlmProperties llm = new LlmProperties();

    // ==================== CONSOLIDATION ====================

    @Data
    public static class ConsolidationProperties {
        /** Consolidate when the buffered token estimate crosses the chunk size. */
        private boolean autoConsolidation = true;

        /** Consolidate early when the buffered batch is surprising enough. */
        private boolean surpriseDetection = true;

        private int chunkSizeTokens = 5000;
        private int minMessagesForEngram = 3;
        private double surpriseThreshold = 0.7;

        /** Oldest buffered messages are dropped beyond this size. */
        private int maxBufferSize = 100;

        private double charsPerToken = 4.0;

        /** Lease of the per-thread consolidation lock; a stuck lock expires after it. */
        private Duration lockLease = Duration.ofSeconds(60);

        /** Upper bound for persisting a new engram. */
        private Duration storeTimeout = Duration.ofSeconds(10);
    }

    // ==================== SUMMARIZER ====================

    @Data
    public static class SummarizerProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxMessageChars = 500;
        private int maxMessages = 10;
        private int maxSummaryTokens = 300;
        private double temperature = 0.3;
    }

    // ==================== DECAY ====================

    @Data
    public static class DecayProperties {
        /** Fraction of relevance kept per day without access. */
        private double decayRate = 0.95;
        private double reinforcementBoost = 0.2;
        private double maxRelevance = 5.0;
    }

    // ==================== RETRIEVAL ====================

    @Data
    public static class RetrievalProperties {
        private int maxEngramsInContext = 5;
        private double recencyHalfLifeDays = 7.0;

        /** log1p(accessCount) is divided by this value and capped at 1. */
        private double accessSaturation = 3.0;

        private Duration storeTimeout = Duration.ofSeconds(30);
        private WeightsProperties weights = new WeightsProperties();
    }

    /**
     * Weights of the composite retrieval score. They must sum to 1.
     */
    @Data
    public static class WeightsProperties {
        private double relevance = 0.4;
        private double surprise = 0.2;
        private double access = 0.2;
        private double recency = 0.1;
        private double similarity = 0.1;

        public double sum() {
            return relevance + surprise + access + recency + similarity;
        }
    }

    // ==================== CLEANUP ====================

    @Data
    public static class CleanupProperties {
        private boolean enabled = true;
        private int maxAgeDays = 30;
        private double minRelevance = 0.1;
        private Duration interval = Duration.ofHours(6);
        private Duration storeTimeout = Duration.ofSeconds(30);
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/engrams";
        private String directory = "engrams";
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** "openai" (or any OpenAI-compatible endpoint) or "anthropic". */
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
    }
}
