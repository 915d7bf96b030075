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

import lombok.Value;

import java.util.Optional;

/**
 * Result of a consolidation attempt: the status, the trigger that fired (if
 * any), and the created engram for {@link ConsolidationStatus#CREATED}.
 */
@Value
public class ConsolidationResult {

    ConsolidationStatus status;
    EngramTrigger trigger;
    Engram engram;

    public static ConsolidationResult created(Engram engram) {
        return new ConsolidationResult(ConsolidationStatus.CREATED, engram.getTrigger(), engram);
    }

    public static ConsolidationResult skipped(ConsolidationStatus status) {
        return new ConsolidationResult(status, null, null);
    }

    public static ConsolidationResult failed(ConsolidationStatus status, EngramTrigger trigger) {
        return new ConsolidationResult(status, trigger, null);
    }

    public boolean isCreated() {
        return status == ConsolidationStatus.CREATED;
    }

    public Optional<Engram> asOptional() {
        return Optional.ofNullable(engram);
    }
}
