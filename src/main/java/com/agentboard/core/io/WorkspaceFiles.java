package com.agentboard.core.io;

import com.agentboard.core.metrics.BoardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-system primitives shared by the store, ledger and subscription index.
 * <p>
 * Whole-document writes go to a temporary sibling file that is then atomically
 * renamed over the target, so readers never observe a half-written record.
 * Transient {@link IOException}s are retried with linear backoff; failures that
 * retrying cannot fix (missing file, permission denied) surface immediately as
 * {@link StorageException}.
 */
public class WorkspaceFiles {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceFiles.class);

    private final int maxAttempts;
    private final long backoffMillis;
    private final BoardMetrics metrics;

    public WorkspaceFiles(int maxAttempts, long backoffMillis, BoardMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoffMillis = Math.max(0, backoffMillis);
        this.metrics = metrics;
    }

    @FunctionalInterface
    interface IoAction<T> {
        T run() throws IOException;
    }

    public String read(Path path) {
        return withRetry("read", path, () -> Files.readString(path, StandardCharsets.UTF_8));
    }

    public Optional<String> readIfExists(Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path));
    }

    public void writeAtomically(Path target, String content) {
        withRetry("write", target, () -> {
            Files.createDirectories(target.getParent());
            Path temp = target.resolveSibling("." + target.getFileName() + ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            moveReplacing(temp, target);
            return null;
        });
    }

    public void append(Path path, String content) {
        withRetry("append", path, () -> {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            return null;
        });
    }

    /**
     * Relocates a file in a single rename where the file system supports it.
     */
    public void move(Path source, Path target) {
        withRetry("move", source, () -> {
            Files.createDirectories(target.getParent());
            moveReplacing(source, target);
            return null;
        });
    }

    /**
     * Lists the markdown files of a directory in file-name order. A missing
     * directory lists as empty.
     */
    public List<Path> listMarkdown(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        return withRetry("list", dir, () -> {
            try (Stream<Path> stream = Files.list(dir)) {
                return stream
                        .filter(Files::isRegularFile)
                        .filter(p -> {
                            String name = p.getFileName().toString();
                            return name.endsWith(".md") && !name.startsWith(".");
                        })
                        .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                        .toList();
            }
        });
    }

    <T> T withRetry(String operation, Path path, IoAction<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.run();
            } catch (IOException e) {
                if (!isTransient(e) || attempt >= maxAttempts) {
                    throw new StorageException(
                            "Failed to %s %s after %d attempt(s): %s".formatted(operation, path, attempt, e.getMessage()), e);
                }
                log.warn("Transient failure during {} of {} (attempt {}/{}): {}",
                        operation, path, attempt, maxAttempts, e.getMessage());
                metrics.recordIoRetry(operation);
                pause(attempt);
            }
        }
    }

    private void pause(int attempt) {
        if (backoffMillis == 0) return;
        try {
            Thread.sleep(backoffMillis * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting to retry", e);
        }
    }

    private static boolean isTransient(IOException e) {
        return !(e instanceof NoSuchFileException
                || e instanceof AccessDeniedException
                || e instanceof FileAlreadyExistsException
                || e instanceof NotDirectoryException);
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException noAtomic) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
