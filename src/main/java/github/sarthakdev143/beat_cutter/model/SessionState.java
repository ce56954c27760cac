package github.sarthakdev143.beat_cutter.model;

public enum SessionState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED
}
