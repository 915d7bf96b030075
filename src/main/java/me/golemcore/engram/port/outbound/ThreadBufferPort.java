package me.golemcore.engram.port.outbound;

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
import me.golemcore.engram.domain.model.ThreadBuffer;

import java.util.List;

/**
 * Per-thread FIFO accumulator of messages awaiting consolidation. Swappable so
 * that several process instances can later share buffers without touching the
 * consolidation logic.
 */
public interface ThreadBufferPort {

    /**
     * Append a message and its token estimate.
     *
     * @return snapshot of the buffer after the append
     */
    ThreadBuffer append(String threadId, Message message, int tokens);

    /**
     * Current snapshot of the buffer; empty when the thread has none.
     */
    ThreadBuffer snapshot(String threadId);

    /**
     * Remove the given messages, matched by identity, once they have been
     * consolidated. Ones already evicted by the cap are skipped; messages
     * appended after the snapshot was taken stay.
     *
     * @return snapshot of what remains
     */
    ThreadBuffer drain(String threadId, List<Message> consolidated);

    /**
     * Drop everything buffered for the thread.
     */
    void clear(String threadId);
}
