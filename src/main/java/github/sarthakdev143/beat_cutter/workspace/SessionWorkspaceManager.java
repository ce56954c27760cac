package github.sarthakdev143.beat_cutter.workspace;

import github.sarthakdev143.beat_cutter.config.BeatCutterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.regex.Pattern;

@Component
public class SessionWorkspaceManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionWorkspaceManager.class);
    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("^[A-Za-z0-9-]{1,64}$");

    private final Path workspaceRoot;
    private final Clock clock;

    @Autowired
    public SessionWorkspaceManager(BeatCutterProperties properties, Clock clock) {
        this(properties.workspaceRoot(), clock);
    }

    public SessionWorkspaceManager(Path workspaceRoot, Clock clock) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.clock = clock;
    }

    /**
     * Creates a fresh directory for the session. Callers should open it in a try-with-resources
     * block so the directory is removed on every exit path.
     */
    public SessionWorkspace open(String sessionId) throws IOException {
        if (sessionId == null || !SESSION_ID_PATTERN.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }

        Path directory = workspaceRoot.resolve(sessionId);
        if (Files.exists(directory)) {
            throw new IOException("Workspace already exists for session " + sessionId);
        }
        Files.createDirectories(directory);
        logger.info("Opened workspace {} for session {}", directory, sessionId);
        return new SessionWorkspace(sessionId, directory, clock.instant());
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }
}
