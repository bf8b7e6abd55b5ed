package com.polyglot.pipeline.execute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

/**
 * A scratch directory owned by one executor call. {@link #close()} deletes
 * it recursively; a failed delete is logged, never thrown.
 */
public final class Workspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path dir;

    Workspace(Path dir) {
        this.dir = dir;
    }

    public Path dir() {
        return dir;
    }

    /**
     * Resolve a relative path inside the workspace. Empty for absolute paths
     * and paths that climb out through {@code ..}.
     */
    public Optional<Path> resolve(String relative) {
        if (relative == null || relative.isBlank()) {
            return Optional.empty();
        }
        Path rel;
        try {
            rel = Path.of(relative);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (rel.isAbsolute()) {
            return Optional.empty();
        }
        Path target = dir.resolve(rel).normalize();
        return target.startsWith(dir) && !target.equals(dir) ? Optional.of(target) : Optional.empty();
    }

    /**
     * Write {@code content} to {@code relative}, creating parent directories.
     *
     * @throws WorkspaceException if the path escapes the workspace or the write fails
     */
    public Path write(String relative, String content) {
        Path target = resolve(relative)
                .orElseThrow(() -> new WorkspaceException("Path escapes workspace: " + relative));
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorkspaceException("Failed to write " + relative + " in " + dir, e);
        }
        return target;
    }

    @Override
    public void close() {
        if (!Files.exists(dir)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    Files.deleteIfExists(d);
                    return FileVisitResult.CONTINUE;
                }
            });
            log.debug("Removed workspace {}", dir);
        } catch (IOException e) {
            log.warn("Failed to remove workspace {}: {}", dir, e.getMessage());
        }
    }
}
