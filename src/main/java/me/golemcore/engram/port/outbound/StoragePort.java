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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * File primitives the engram store is built on. Paths are relative to a
 * directory under the configured storage root.
 */
public interface StoragePort {

    /**
     * Read a whole file. Completes with {@code null} when the file does not
     * exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Names of the regular files directly inside {@code directory}, sorted.
     * Empty when the directory does not exist.
     */
    CompletableFuture<List<String>> listFiles(String directory);

    /**
     * Replace a file's content so that concurrent readers observe either the
     * old or the new content, never a partial write. The content is flushed to
     * a sibling temporary file and renamed over the target.
     */
    CompletableFuture<Void> replaceText(String directory, String path, String content);
}
