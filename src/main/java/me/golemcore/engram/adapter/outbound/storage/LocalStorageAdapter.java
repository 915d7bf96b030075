package me.golemcore.engram.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engram.infrastructure.config.EngramProperties;
import me.golemcore.engram.port.outbound.EngramStoreException;
import me.golemcore.engram.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Filesystem {@link StoragePort} rooted at {@code engram.storage.base-path}
 * (default {@code ${user.home}/.golemcore/engrams}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String TEMP_SUFFIX = ".tmp";

    private final EngramProperties properties;

    private Path root;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        root = Paths.get(configured).toAbsolutePath().normalize();
        Path engramDir = root.resolve(properties.getStorage().getDirectory());
        try {
            Files.createDirectories(engramDir);
            log.info("[EngramStore] Storage root: {}", root);
        } catch (IOException e) {
            log.error("[EngramStore] Cannot create storage directory {}", engramDir, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolve(directory, path);
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                throw new EngramStoreException("Cannot read " + file, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listFiles(String directory) {
        return CompletableFuture.supplyAsync(() -> {
            Path dir = resolve(directory, ".");
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            try (Stream<Path> entries = Files.list(dir)) {
                return entries.filter(Files::isRegularFile)
                        .map(p -> p.getFileName().toString())
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new EngramStoreException("Cannot list " + dir, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> replaceText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> replace(resolve(directory, path), content));
    }

    private void replace(Path target, String content) {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(target.getParent());
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            discard(temp);
            throw new EngramStoreException("Cannot write " + target, e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[EngramStore] Atomic rename unsupported for {}, falling back to plain move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[EngramStore] Leftover temp file {}: {}", temp, e.getMessage());
        }
    }

    private Path resolve(String directory, String path) {
        Path resolved = root.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes storage root: " + directory + "/" + path);
        }
        return resolved;
    }
}
