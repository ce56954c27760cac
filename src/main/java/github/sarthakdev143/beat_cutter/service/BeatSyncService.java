package github.sarthakdev143.beat_cutter.service;

import github.sarthakdev143.beat_cutter.dto.ProcessSessionRequest;
import github.sarthakdev143.beat_cutter.model.SessionStatus;

import java.nio.file.Path;
import java.util.Optional;

public interface BeatSyncService {

    String submitSession(ProcessSessionRequest request, String clientId);

    Optional<SessionStatus> getSessionStatus(String sessionId);

    Path outputPath(String sessionId);
}
