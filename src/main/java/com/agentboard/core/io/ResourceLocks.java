package com.agentboard.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Scoped exclusive access to a named workspace resource ({@code tasks},
 * {@code notifications}, {@code subscriptions/<agent>}).
 * <p>
 * Threads of this process serialize on a reentrant lock per resource. When file
 * locks are enabled the outermost holder also takes an OS lock on
 * {@code .locks/<resource>.lock}, so separate processes sharing the workspace
 * serialize too. Nested acquisition of the same resource by the holding thread
 * is allowed. Callers that need several resources take them in the order
 * tasks, notifications, subscriptions.
 */
public class ResourceLocks {

    private static final Logger log = LoggerFactory.getLogger(ResourceLocks.class);

    private final Path locksDir;
    private final boolean fileLocks;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ResourceLocks(Workspace workspace, boolean fileLocks) {
        this.locksDir = workspace.locksDir();
        this.fileLocks = fileLocks;
    }

    public <T> T withExclusive(String resource, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(resource, k -> new ReentrantLock());
        lock.lock();
        try {
            if (fileLocks && lock.getHoldCount() == 1) {
                return withFileLock(resource, action);
            }
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withExclusive(String resource, Runnable action) {
        withExclusive(resource, () -> {
            action.run();
            return null;
        });
    }

    /** True if the current thread holds the named resource. */
    public boolean isHeldByCurrentThread(String resource) {
        ReentrantLock lock = locks.get(resource);
        return lock != null && lock.isHeldByCurrentThread();
    }

    private <T> T withFileLock(String resource, Supplier<T> action) {
        Path lockFile = locksDir.resolve(resource.replace('/', '-') + ".lock");
        try {
            Files.createDirectories(locksDir);
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                log.trace("Acquired file lock {}", lockFile);
                return action.get();
            }
        } catch (IOException e) {
            throw new StorageException("Failed to lock " + lockFile, e);
        }
    }
}
