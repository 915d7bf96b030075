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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What caused a buffer to be consolidated into an engram.
 */
public enum EngramTrigger {

    TOKEN_THRESHOLD("token_threshold"), SURPRISE("surprise"), FORCED("forced");

    private final String value;

    EngramTrigger(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
