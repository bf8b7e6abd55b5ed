package com.polyglot.pipeline.execute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out scratch directories for executor calls.
 *
 * Names combine a per-target prefix, a counter owned by this bean and a
 * random suffix, so concurrent calls never share a directory even across
 * processes using the same root.
 */
@Component
public class Workspaces {

    private static final Logger log = LoggerFactory.getLogger(Workspaces.class);

    private final Path       root;
    private final AtomicLong counter = new AtomicLong();

    public Workspaces(@Value("${polyglot.executor.workspace-root:${java.io.tmpdir}}") String root) {
        this.root = Path.of(root);
    }

    /**
     * Create a fresh, empty directory. Close the returned workspace to
     * remove it; use try-with-resources.
     *
     * @throws WorkspaceException if the directory cannot be created
     */
    public Workspace acquire(String prefix) {
        String name = "polyglot_" + prefix + "_" + counter.incrementAndGet()
                + "_" + UUID.randomUUID().toString().substring(0, 8);
        Path dir = root.resolve(name);
        try {
            Files.createDirectories(root);
            Files.createDirectory(dir);
        } catch (IOException e) {
            throw new WorkspaceException("Failed to create workspace " + dir, e);
        }
        log.info("Created workspace {}", dir);
        return new Workspace(dir);
    }
}
