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

/**
 * How a thread's engram creation times are spread: regular gaps (uniform) or
 * clustered (bursty).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemporalDistribution {

    public enum Pattern {
        INSUFFICIENT_DATA, UNIFORM, BURSTY
    }

    private Pattern pattern;
    private double meanGapSeconds;
    private double stdDevGapSeconds;
    private double totalSpanHours;

    public static TemporalDistribution insufficientData() {
        return TemporalDistribution.builder().pattern(Pattern.INSUFFICIENT_DATA).build();
    }
}
