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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword membership tagging: technical terms first, then action words, at most
 * {@value #MAX_TOPICS} tags. A keyword matches at the start of a word, so
 * "implement" also tags "implementing".
 */
@Component
public class KeywordTopicExtractor implements TopicExtractor {

    static final int MAX_TOPICS = 5;

    private static final List<String> TECH_TERMS = List.of("api", "database", "function", "error",
            "implementation", "bug", "feature", "performance", "memory", "token");
    private static final List<String> ACTION_WORDS = List.of("create", "implement", "fix", "debug", "optimize",
            "design", "build", "deploy");

    private final List<Keyword> keywords = new ArrayList<>();

    public KeywordTopicExtractor() {
        for (String term : TECH_TERMS) {
            keywords.add(new Keyword(term));
        }
        for (String word : ACTION_WORDS) {
            keywords.add(new Keyword(word));
        }
    }

    @Override
    public List<String> extractTopics(String text) {
        List<String> topics = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return topics;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Keyword keyword : keywords) {
            if (topics.size() >= MAX_TOPICS) {
                break;
            }
            if (keyword.pattern().matcher(lower).find()) {
                topics.add(keyword.value());
            }
        }
        return topics;
    }

    private record Keyword(String value, Pattern pattern) {
        Keyword(String value) {
            this(value, Pattern.compile("\\b" + Pattern.quote(value)));
        }
    }
}
