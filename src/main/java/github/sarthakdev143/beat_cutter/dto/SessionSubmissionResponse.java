package github.sarthakdev143.beat_cutter.dto;

import github.sarthakdev143.beat_cutter.model.SessionState;

public record SessionSubmissionResponse(
        String sessionId,
        SessionState state,
        String message) {
}
