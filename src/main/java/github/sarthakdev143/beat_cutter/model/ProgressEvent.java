package github.sarthakdev143.beat_cutter.model;

import github.sarthakdev143.beat_cutter.progress.ProcessingPhase;

public record ProgressEvent(
        ProcessingPhase phase,
        double percent,
        double elapsedSeconds,
        double etaSeconds,
        double overallPercent,
        double overallElapsedSeconds) {
}
