package me.golemcore.steward.testsupport;

import me.golemcore.steward.port.outbound.StoragePort;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Delegating {@link StoragePort} that records the absolute path of every
 * mutating call.
 */
public class RecordingStoragePort implements StoragePort {

    private final StoragePort delegate;
    private final List<Path> writes = new CopyOnWriteArrayList<>();

    public RecordingStoragePort(StoragePort delegate) {
        this.delegate = delegate;
    }

    public List<Path> getWrites() {
        return List.copyOf(writes);
    }

    public void clear() {
        writes.clear();
    }

    private void record(Path root, String path) {
        writes.add(delegate.resolve(root, path));
    }

    @Override
    public Path resolve(Path root, String path) {
        return delegate.resolve(root, path);
    }

    @Override
    public CompletableFuture<String> getText(Path root, String path) {
        return delegate.getText(root, path);
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(Path root, String path, String content) {
        record(root, path);
        return delegate.putTextAtomic(root, path, content);
    }

    @Override
    public CompletableFuture<Void> appendText(Path root, String path, String content) {
        record(root, path);
        return delegate.appendText(root, path, content);
    }

    @Override
    public CompletableFuture<Boolean> exists(Path root, String path) {
        return delegate.exists(root, path);
    }

    @Override
    public CompletableFuture<Long> size(Path root, String path) {
        return delegate.size(root, path);
    }

    @Override
    public CompletableFuture<Instant> lastModified(Path root, String path) {
        return delegate.lastModified(root, path);
    }

    @Override
    public CompletableFuture<List<String>> listObjects(Path root, String prefix) {
        return delegate.listObjects(root, prefix);
    }

    @Override
    public CompletableFuture<List<String>> listDirectories(Path root, String path) {
        return delegate.listDirectories(root, path);
    }

    @Override
    public CompletableFuture<Void> deleteObject(Path root, String path) {
        record(root, path);
        return delegate.deleteObject(root, path);
    }

    @Override
    public CompletableFuture<Void> deleteTree(Path root, String path) {
        record(root, path);
        return delegate.deleteTree(root, path);
    }

    @Override
    public CompletableFuture<Void> move(Path root, String fromPath, String toPath) {
        record(root, fromPath);
        record(root, toPath);
        return delegate.move(root, fromPath, toPath);
    }

    @Override
    public CompletableFuture<Long> copyFrom(Path source, Path root, String path) {
        record(root, path);
        return delegate.copyFrom(source, root, path);
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(Path root, String path) {
        return delegate.ensureDirectory(root, path);
    }

    @Override
    public CompletableFuture<Boolean> createDirectory(Path root, String path) {
        record(root, path);
        return delegate.createDirectory(root, path);
    }

    @Override
    public <T> T withExclusiveLock(Path root, String lockPath, Duration timeout, Supplier<T> action) {
        return delegate.withExclusiveLock(root, lockPath, timeout, action);
    }
}
