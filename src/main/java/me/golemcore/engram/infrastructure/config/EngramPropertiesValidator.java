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

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup validation of {@link EngramProperties}. Configuration errors are the
 * only fatal failures of the engine, so every problem is collected and reported
 * in a single {@link IllegalStateException}.
 */
@Component
public class EngramPropertiesValidator {

    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    public void validate(EngramProperties properties) {
        List<String> errors = collectErrors(properties);
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid engram configuration: " + String.join("; ", errors));
        }
    }

    List<String> collectErrors(EngramProperties properties) {
        List<String> errors = new ArrayList<>();

        EngramProperties.ConsolidationProperties consolidation = properties.getConsolidation();
        if (consolidation.getChunkSizeTokens() <= 0) {
            errors.add("consolidation.chunk-size-tokens must be positive");
        }
        if (consolidation.getMinMessagesForEngram() < 1) {
            errors.add("consolidation.min-messages-for-engram must be at least 1");
        }
        if (!inUnitRange(consolidation.getSurpriseThreshold())) {
            errors.add("consolidation.surprise-threshold must be within [0, 1]");
        }
        if (consolidation.getMaxBufferSize() < consolidation.getMinMessagesForEngram()) {
            errors.add("consolidation.max-buffer-size must not be below min-messages-for-engram");
        }
        if (consolidation.getCharsPerToken() <= 0) {
            errors.add("consolidation.chars-per-token must be positive");
        }
        requirePositive(errors, "consolidation.lock-lease", consolidation.getLockLease());
        requirePositive(errors, "consolidation.store-timeout", consolidation.getStoreTimeout());

        EngramProperties.SummarizerProperties summarizer = properties.getSummarizer();
        requirePositive(errors, "summarizer.timeout", summarizer.getTimeout());
        if (summarizer.getMaxMessageChars() <= 0 || summarizer.getMaxMessages() <= 0
                || summarizer.getMaxSummaryTokens() <= 0) {
            errors.add("summarizer limits must be positive");
        }
        if (consolidation.getLockLease() != null && summarizer.getTimeout() != null
                && consolidation.getStoreTimeout() != null
                && consolidation.getLockLease()
                        .compareTo(summarizer.getTimeout().plus(consolidation.getStoreTimeout())) <= 0) {
            errors.add("consolidation.lock-lease must exceed summarizer.timeout + consolidation.store-timeout");
        }

        Duration llmTimeout = properties.getLlm().getLangchain4j().getTimeout();
        if ("langchain4j".equals(properties.getLlm().getProvider())) {
            requirePositive(errors, "llm.langchain4j.timeout", llmTimeout);
            if (llmTimeout != null && summarizer.getTimeout() != null
                    && llmTimeout.compareTo(summarizer.getTimeout()) > 0) {
                errors.add("llm.langchain4j.timeout must not exceed summarizer.timeout");
            }
        }

        EngramProperties.DecayProperties decay = properties.getDecay();
        if (decay.getDecayRate() <= 0 || decay.getDecayRate() > 1) {
            errors.add("decay.decay-rate must be within (0, 1]");
        }
        if (decay.getReinforcementBoost() < 0) {
            errors.add("decay.reinforcement-boost must not be negative");
        }
        if (decay.getMaxRelevance() < 1.0) {
            errors.add("decay.max-relevance must be at least the initial relevance 1.0");
        }

        EngramProperties.RetrievalProperties retrieval = properties.getRetrieval();
        if (retrieval.getMaxEngramsInContext() < 1) {
            errors.add("retrieval.max-engrams-in-context must be at least 1");
        }
        if (retrieval.getRecencyHalfLifeDays() <= 0) {
            errors.add("retrieval.recency-half-life-days must be positive");
        }
        if (retrieval.getAccessSaturation() <= 0) {
            errors.add("retrieval.access-saturation must be positive");
        }
        requirePositive(errors, "retrieval.store-timeout", retrieval.getStoreTimeout());
        EngramProperties.WeightsProperties weights = retrieval.getWeights();
        if (weights.getRelevance() < 0 || weights.getSurprise() < 0 || weights.getAccess() < 0
                || weights.getRecency() < 0 || weights.getSimilarity() < 0) {
            errors.add("retrieval.weights must not be negative");
        }
        if (Math.abs(weights.sum() - 1.0) > WEIGHT_SUM_TOLERANCE) {
            errors.add("retrieval.weights must sum to 1 (was " + weights.sum() + ")");
        }

        EngramProperties.CleanupProperties cleanup = properties.getCleanup();
        if (cleanup.getMaxAgeDays() < 0) {
            errors.add("cleanup.max-age-days must not be negative");
        }
        if (cleanup.getMinRelevance() < 0) {
            errors.add("cleanup.min-relevance must not be negative");
        }
        requirePositive(errors, "cleanup.interval", cleanup.getInterval());
        requirePositive(errors, "cleanup.store-timeout", cleanup.getStoreTimeout());

        return errors;
    }

    private void requirePositive(List<String> errors, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            errors.add(name + " must be a positive duration");
        }
    }

    private boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
