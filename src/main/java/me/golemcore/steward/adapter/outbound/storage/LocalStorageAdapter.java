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

package me.golemcore.steward.adapter.outbound.storage;

import me.golemcore.steward.domain.model.StewardException;
import me.golemcore.steward.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Operates on arbitrary project state roots. Every relative path is normalized
 * and checked against its root before the filesystem is touched, so
 * {@code ../} escapes never reach the disk.
 *
 * <p>
 * Exclusive locks combine a per-file {@link ReentrantLock} (threads of this
 * JVM) with an OS-level {@link FileLock} (other agent processes).
 *
 * @see me.golemcore.steward.port.outbound.StoragePort
 */
@Component
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final long LOCK_POLL_MILLIS = 50;

    private final Map<Path, ReentrantLock> localLocks = new ConcurrentHashMap<>();

    @Override
    public Path resolve(Path root, String path) {
        return resolvePath(root, path);
    }

    @Override
    public CompletableFuture<String> getText(Path root, String path) {
        Path filePath = resolvePath(root, path);
        return CompletableFuture.supplyAsync(() -> {
            try {
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + filePath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(Path root, String path, String content) {
        Path targetPath = resolvePath(root, path);
        return CompletableFuture.runAsync(() -> writeAtomically(targetPath, content));
    }

    @Override
    public CompletableFuture<Void> appendText(Path root, String path, String content) {
        Path filePath = resolvePath(root, path);
        return CompletableFuture.runAsync(() -> {
            try {
                createParent(filePath);
                Files.writeString(filePath, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND,
                        StandardOpenOption.SYNC);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to file: " + filePath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(Path root, String path) {
        Path filePath = resolvePath(root, path);
        return CompletableFuture.supplyAsync(() -> Files.exists(filePath));
    }

    @Override
    public CompletableFuture<Long> size(Path root, String path) {
        Path filePath = resolvePath(root, path);
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Files.exists(filePath) ? Files.size(filePath) : -1L;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to stat file: " + filePath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Instant> lastModified(Path root, String path) {
        Path filePath = resolvePath(root, path);
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Files.getLastModifiedTime(filePath).toInstant();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to stat file: " + filePath, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(Path root, String prefix) {
        Path normalizedRoot = normalizeRoot(root);
        Path prefixPath = prefix != null && !prefix.isEmpty()
                ? resolvePath(root, prefix)
                : normalizedRoot;
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.exists(prefixPath)) {
                return Collections.emptyList();
            }
            try (Stream<Path> paths = Files.walk(prefixPath)) {
                return paths
                        .filter(Files::isRegularFile)
                        .map(p -> toRelative(normalizedRoot, p))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list files: " + prefixPath, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listDirectories(Path root, String path) {
        Path dirPath = resolvePath(root, path);
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.isDirectory(dirPath)) {
                return Collections.emptyList();
            }
            try (Stream<Path> children = Files.list(dirPath)) {
                return children
                        .filter(Files::isDirectory)
                        .map(p -> p.getFileName().toString())
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list directories: " + dirPath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(Path root, String path) {
        Path filePath = resolvePath(root, path);
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(filePath);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete file: " + filePath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteTree(Path root, String path) {
        Path dirPath = resolvePath(root, path);
        if (dirPath.equals(normalizeRoot(root))) {
            throw StewardException.security("Refusing to delete storage root: " + root);
        }
        return CompletableFuture.runAsync(() -> {
            if (!Files.exists(dirPath)) {
                return;
            }
            try (Stream<Path> paths = Files.walk(dirPath)) {
                List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
                for (Path p : ordered) {
                    Files.deleteIfExists(p);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete directory: " + dirPath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> move(Path root, String fromPath, String toPath) {
        Path source = resolvePath(root, fromPath);
        Path target = resolvePath(root, toPath);
        return CompletableFuture.runAsync(() -> {
            try {
                createParent(target);
                moveReplacing(source, target);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to move " + source + " to " + target, e);
            }
        });
    }

    @Override
    public CompletableFuture<Long> copyFrom(Path source, Path root, String path) {
        Path target = resolvePath(root, path);
        return CompletableFuture.supplyAsync(() -> {
            Path tempPath = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                createParent(target);
                Files.copy(source, tempPath, StandardCopyOption.REPLACE_EXISTING);
                try (FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }
                moveReplacing(tempPath, target);
                long written = Files.size(target);
                log.debug("[Storage] Copied {} bytes from {} to {}", written, source, target);
                return written;
            } catch (IOException e) {
                deleteQuietly(tempPath);
                throw new UncheckedIOException("Failed to copy " + source + " to " + target, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(Path root, String path) {
        Path dirPath = path == null || path.isEmpty() ? normalizeRoot(root) : resolvePath(root, path);
        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(dirPath);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create directory: " + dirPath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> createDirectory(Path root, String path) {
        Path dirPath = resolvePath(root, path);
        return CompletableFuture.supplyAsync(() -> {
            try {
                createParent(dirPath);
                Files.createDirectory(dirPath);
                return true;
            } catch (FileAlreadyExistsException e) {
                return false;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create directory: " + dirPath, e);
            }
        });
    }

    @Override
    public <T> T withExclusiveLock(Path root, String lockPath, Duration timeout, Supplier<T> action) {
        Path lockFile = resolvePath(root, lockPath);
        long deadline = System.nanoTime() + timeout.toNanos();
        ReentrantLock localLock = localLocks.computeIfAbsent(lockFile, p -> new ReentrantLock());

        try {
            if (!localLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw StewardException.transientFailure("Timed out waiting for lock: " + lockPath, null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StewardException.transientFailure("Interrupted waiting for lock: " + lockPath, e);
        }

        try {
            createParent(lockFile);
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                FileLock fileLock = acquireFileLock(channel, deadline, lockPath);
                try {
                    return action.get();
                } finally {
                    fileLock.release();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to lock " + lockFile, e);
        } finally {
            localLock.unlock();
        }
    }

    private FileLock acquireFileLock(FileChannel channel, long deadline, String lockPath) throws IOException {
        while (true) {
            FileLock lock = channel.tryLock();
            if (lock != null) {
                return lock;
            }
            if (System.nanoTime() >= deadline) {
                throw StewardException.transientFailure("Lock held by another process: " + lockPath, null);
            }
            try {
                Thread.sleep(LOCK_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw StewardException.transientFailure("Interrupted waiting for lock: " + lockPath, e);
            }
        }
    }

    private void writeAtomically(Path targetPath, String content) {
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        try {
            createParent(targetPath);

            // 1. Write to temp file with fsync
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            // 2. Verify written content is readable
            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            // 3. Atomic rename
            moveReplacing(tempPath, targetPath);
            log.debug("[Storage] Atomic write completed: {}", targetPath);
        } catch (IOException e) {
            deleteQuietly(tempPath);
            throw new UncheckedIOException("Atomic write failed: " + targetPath, e);
        }
    }

    private void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanupEx) {
            log.warn("[Storage] Failed to cleanup temp file: {}", path);
        }
    }

    private Path normalizeRoot(Path root) {
        return root.toAbsolutePath().normalize();
    }

    private String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private Path resolvePath(Path root, String path) {
        if (root == null || path == null) {
            throw StewardException.validation("Storage root and path are required");
        }
        Path normalizedRoot = normalizeRoot(root);
        Path resolved = normalizedRoot.resolve(path).normalize();
        if (!resolved.startsWith(normalizedRoot)) {
            log.warn("[Storage] Path traversal blocked: root={}, path={}", normalizedRoot, path);
            throw StewardException.security("Path traversal blocked: " + path);
        }
        return resolved;
    }
}
