package me.golemcore.steward.port.outbound;

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

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Port for filesystem operations inside a project's state tree. Every
 * operation takes the root it is confined to plus a relative path; paths that
 * normalize outside the root are rejected before any filesystem access.
 */
public interface StoragePort {

    /**
     * Resolve a relative path against a root, rejecting traversal outside it.
     * Purely lexical: nothing is read from disk.
     *
     * @throws me.golemcore.steward.domain.model.StewardException
     *             of kind SECURITY if the path escapes the root
     */
    Path resolve(Path root, String path);

    /**
     * Read text content from file, or {@code null} if it does not exist.
     */
    CompletableFuture<String> getText(Path root, String path);

    /**
     * Atomically write text content to file.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     */
    CompletableFuture<Void> putTextAtomic(Path root, String path, String content);

    /**
     * Append text to a file (for logs, JSONL, history).
     */
    CompletableFuture<Void> appendText(Path root, String path, String content);

    CompletableFuture<Boolean> exists(Path root, String path);

    /**
     * Size in bytes, or {@code -1} if the file does not exist.
     */
    CompletableFuture<Long> size(Path root, String path);

    CompletableFuture<Instant> lastModified(Path root, String path);

    /**
     * List regular files below {@code prefix}, relative to the root.
     */
    CompletableFuture<List<String>> listObjects(Path root, String prefix);

    /**
     * List immediate subdirectory names of {@code path}.
     */
    CompletableFuture<List<String>> listDirectories(Path root, String path);

    CompletableFuture<Void> deleteObject(Path root, String path);

    /**
     * Recursively delete a directory.
     */
    CompletableFuture<Void> deleteTree(Path root, String path);

    /**
     * Move a file within the root, replacing the target atomically where the
     * filesystem allows it.
     */
    CompletableFuture<Void> move(Path root, String fromPath, String toPath);

    /**
     * Copy an external file byte-for-byte into the root.
     *
     * @return number of bytes written
     */
    CompletableFuture<Long> copyFrom(Path source, Path root, String path);

    CompletableFuture<Void> ensureDirectory(Path root, String path);

    /**
     * Create a single directory.
     *
     * @return {@code false} if it already existed
     */
    CompletableFuture<Boolean> createDirectory(Path root, String path);

    /**
     * Run {@code action} while holding an exclusive lock on {@code lockPath},
     * shared by threads of this process and by other processes.
     *
     * @throws me.golemcore.steward.domain.model.StewardException
     *             of kind TRANSIENT if the lock is not acquired in time
     */
    <T> T withExclusiveLock(Path root, String lockPath, Duration timeout, Supplier<T> action);
}
