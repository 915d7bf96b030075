package me.golemcore.engram.adapter.outbound.buffer;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.domain.model.Message;
import me.golemcore.engram.domain.model.ThreadBuffer;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.ThreadBufferPort;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process thread buffers keyed by thread id.
 *
 * <p>
 * Mutations run inside the map's per-key {@code compute}, so appends to
 * different threads never contend and an emptied buffer can be removed without
 * losing a concurrent append. Beyond
 * {@code engram.consolidation.max-buffer-size} the oldest messages are
 * dropped.
 */
@Component
@Slf4j
public class InMemoryThreadBufferAdapter implements ThreadBufferPort {

    private final EngramProperties properties;
    private final Map<String, Buffer> buffers = new ConcurrentHashMap<>();

    public InMemoryThreadBufferAdapter(EngramProperties properties) {
        this.properties = properties;
    }

    @Override
    public ThreadBuffer append(String threadId, Message message, int tokens) {
        ThreadBuffer[] result = new ThreadBuffer[1];
        buffers.compute(threadId, (key, existing) -> {
            Buffer buffer = existing != null ? existing : new Buffer();
            synchronized (buffer) {
                int cost = Math.max(0, tokens);
                buffer.entries.addLast(new Entry(message, cost));
                buffer.tokens += cost;
                evictOverflow(threadId, buffer);
                result[0] = toSnapshot(threadId, buffer);
            }
            return buffer;
        });
        return result[0];
    }

    @Override
    public ThreadBuffer snapshot(String threadId) {
        Buffer buffer = buffers.get(threadId);
        if (buffer == null) {
            return ThreadBuffer.empty(threadId);
        }
        synchronized (buffer) {
            return toSnapshot(threadId, buffer);
        }
    }

    /**
     * Removes every consolidated message still buffered, matched by identity.
     * Messages the size cap already evicted are simply absent; messages
     * appended during the consolidation stay queued in order.
     */
    @Override
    public ThreadBuffer drain(String threadId, List<Message> consolidated) {
        Set<Message> done = Collections.newSetFromMap(new IdentityHashMap<>());
        done.addAll(consolidated);
        ThreadBuffer[] result = { ThreadBuffer.empty(threadId) };
        buffers.computeIfPresent(threadId, (key, buffer) -> {
            synchronized (buffer) {
                buffer.entries.removeIf(entry -> done.contains(entry.message()));
                buffer.tokens = buffer.entries.stream().mapToInt(Entry::tokens).sum();
                result[0] = toSnapshot(threadId, buffer);
                return buffer.entries.isEmpty() ? null : buffer;
            }
        });
        return result[0];
    }

    @Override
    public void clear(String threadId) {
        buffers.remove(threadId);
    }

    int trackedThreads() {
        return buffers.size();
    }

    private void evictOverflow(String threadId, Buffer buffer) {
        int maxSize = properties.getConsolidation().getMaxBufferSize();
        int dropped = 0;
        while (buffer.entries.size() > maxSize) {
            buffer.tokens -= buffer.entries.removeFirst().tokens();
            dropped++;
        }
        if (dropped > 0) {
            log.warn("[Engram] Buffer for thread {} exceeded {} messages, dropped {} oldest",
                    threadId, maxSize, dropped);
        }
    }

    private ThreadBuffer toSnapshot(String threadId, Buffer buffer) {
        return ThreadBuffer.builder()
                .threadId(threadId)
                .messages(buffer.entries.stream().map(Entry::message).toList())
                .tokenEstimate(buffer.tokens)
                .build();
    }

    private static final class Buffer {
        private final Deque<Entry> entries = new ArrayDeque<>();
        private int tokens;
    }

    private record Entry(Message message, int tokens) {
    }
}
