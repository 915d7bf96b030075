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

import me.golemcore.engram.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Additive lexical surprise heuristic.
 *
 * <ul>
 * <li>category diversity: distinct coarse categories / message count, weight
 * 0.3</li>
 * <li>emotional intensity: mean of (exclamation marks + all-caps flag) per
 * message, times 0.2, at most 0.3</li>
 * <li>code blocks: 0.2</li>
 * <li>error language: 0.2</li>
 * <li>average message length above 500 chars: 0.1</li>
 * </ul>
 * The sum is clamped to [0, 1].
 */
@Component
public class HeuristicSurpriseScorer implements SurpriseScorer {

    static final double DIVERSITY_WEIGHT = 0.3;
    static final double INTENSITY_WEIGHT = 0.2;
    static final double INTENSITY_CAP = 0.3;
    static final double CODE_WEIGHT = 0.2;
    static final double ERROR_WEIGHT = 0.2;
    static final double DENSITY_WEIGHT = 0.1;
    static final int DENSITY_CHARS = 500;

    enum Category {
        ERROR, IMPLEMENTATION, QUESTION, EXCLAMATION
    }

    @Override
    public double score(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return 0.0;
        }
        int count = messages.size();

        Set<Category> categories = EnumSet.noneOf(Category.class);
        double intensity = 0.0;
        boolean hasCode = false;
        boolean hasError = false;
        long totalChars = 0;

        for (Message message : messages) {
            String text = message.getContent() != null ? message.getContent() : "";
            String lower = text.toLowerCase(Locale.ROOT);

            if (lower.contains("error") || lower.contains("exception")) {
                categories.add(Category.ERROR);
            }
            if (lower.contains("implement") || lower.contains("create")) {
                categories.add(Category.IMPLEMENTATION);
            }
            if (text.indexOf('?') >= 0) {
                categories.add(Category.QUESTION);
            }
            if (text.indexOf('!') >= 0) {
                categories.add(Category.EXCLAMATION);
            }

            intensity += countChar(text, '!') + (MessageSignals.isShouting(text) ? 1 : 0);
            hasCode |= MessageSignals.containsCode(text);
            hasError |= MessageSignals.containsErrorLanguage(text);
            totalChars += text.length();
        }

        double score = (double) categories.size() / count * DIVERSITY_WEIGHT;
        score += Math.min(intensity / count * INTENSITY_WEIGHT, INTENSITY_CAP);
        if (hasCode) {
            score += CODE_WEIGHT;
        }
        if (hasError) {
            score += ERROR_WEIGHT;
        }
        if ((double) totalChars / count > DENSITY_CHARS) {
            score += DENSITY_WEIGHT;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static int countChar(String text, char target) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == target) {
                count++;
            }
        }
        return count;
    }
}
