package github.sarthakdev143.beat_cutter.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Scratch directory owned by exactly one processing session. Closing the workspace removes the
 * directory and everything in it.
 */
public final class SessionWorkspace implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SessionWorkspace.class);

    private final String sessionId;
    private final Path directory;
    private final Instant createdAt;
    private boolean closed;

    SessionWorkspace(String sessionId, Path directory, Instant createdAt) {
        this.sessionId = sessionId;
        this.directory = directory;
        this.createdAt = createdAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public Path directory() {
        return directory;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Path resolve(String fileName) {
        Path resolved = directory.resolve(fileName).normalize();
        if (!resolved.startsWith(directory)) {
            throw new IllegalArgumentException("File name escapes the session workspace: " + fileName);
        }
        return resolved;
    }

    /**
     * Deletes a single intermediate file. Failures are logged, never thrown.
     */
    public void discard(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete intermediate file {} in session {}", path, sessionId, e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (Files.notExists(directory)) {
            return;
        }

        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(this::discard);
        } catch (IOException e) {
            logger.warn("Could not remove workspace {} for session {}", directory, sessionId, e);
            return;
        }
        logger.info("Removed workspace for session {}", sessionId);
    }
}
