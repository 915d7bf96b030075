package me.golemcore.engram.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only diagnostics over one thread's engram population.
 *
 * <p>
 * Defaults on empty or tiny populations: {@code compressionRatio} 0.0,
 * {@code topicDiversity} 0.0, {@code coherence} 1.0 (fewer than two engrams
 * cannot disagree). Statistics that need at least five data points
 * ({@code forgettingCurveR2}, {@code decayConstant}, {@code halfLifeDays},
 * {@code surpriseAccessCorrelation}) are {@code null} when undefined.
 * {@code cognitiveLoad} is 0.0 with status {@link CognitiveLoadStatus#IDLE}
 * when nothing was consolidated in the last hour; {@code hebbianStrength} is
 * 0.0 with fewer than two engrams.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EngramMetricsSnapshot {

    private String threadId;
    private Instant generatedAt;

    private int totalEngrams;
    private int activeEngrams;
    private long totalSourceTokens;
    private double averageSurprise;
    private double averageAccessCount;

    @Builder.Default
    private Map<EngramTrigger, Integer> triggerCounts = new LinkedHashMap<>();

    private double compressionRatio;
    private double topicDiversity;
    private double coherence;

    private Double forgettingCurveR2;
    private Double decayConstant;
    private Double halfLifeDays;
    private Double surpriseAccessCorrelation;

    private TemporalDistribution temporalDistribution;

    private double cognitiveLoad;
    private CognitiveLoadStatus cognitiveLoadStatus;
    private double hebbianStrength;

    public static EngramMetricsSnapshot empty(String threadId, Instant generatedAt) {
        return EngramMetricsSnapshot.builder()
                .threadId(threadId)
                .generatedAt(generatedAt)
                .coherence(1.0)
                .cognitiveLoadStatus(CognitiveLoadStatus.IDLE)
                .temporalDistribution(TemporalDistribution.insufficientData())
                .build();
    }
}
