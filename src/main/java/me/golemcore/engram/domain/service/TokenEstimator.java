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
import me.golemcore.engram.infrastructure.config.EngramProperties;
import org.springframework.stereotype.Component;

/**
 * Character-based token estimate: {@code ceil(chars / charsPerToken)}.
 */
@Component
@RequiredArgsConstructor
public class TokenEstimator {

    private final EngramProperties properties;

    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        double charsPerToken = properties.getConsolidation().getCharsPerToken();
        return (int) Math.ceil(text.length() / charsPerToken);
    }
}
