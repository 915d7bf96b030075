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

/**
 * Outcome of a consolidation attempt. Only {@link #CREATED} produces an
 * engram; every other status leaves pending messages in the buffer.
 */
public enum ConsolidationStatus {
    CREATED,
    /** No trigger fired. */
    BELOW_THRESHOLD,
    /** Trigger fired but the batch is below the minimum message count. */
    NOT_ENOUGH_MESSAGES,
    EMPTY_BUFFER,
    /** Another consolidation for the same thread holds the lock. */
    IN_PROGRESS,
    SUMMARY_FAILED,
    STORE_FAILED,
    DISABLED
}
