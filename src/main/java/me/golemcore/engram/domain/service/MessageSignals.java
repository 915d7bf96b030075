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

import java.util.List;
import java.util.Locale;

/**
 * Lexical signals shared by surprise scoring and engram metadata.
 */
public final class MessageSignals {

    private static final String CODE_FENCE = "```";
    private static final List<String> ERROR_MARKERS = List.of("error", "exception", "failed", "failure",
            "traceback");

    private MessageSignals() {
    }

    public static boolean containsCode(String text) {
        return text != null && text.contains(CODE_FENCE);
    }

    public static boolean containsErrorLanguage(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : ERROR_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the text has at least one cased letter and no lowercase ones.
     */
    public static boolean isShouting(String text) {
        if (text == null) {
            return false;
        }
        boolean cased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLowerCase(c) || Character.isTitleCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                cased = true;
            }
        }
        return cased;
    }
}
