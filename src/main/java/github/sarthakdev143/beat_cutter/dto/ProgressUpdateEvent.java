package github.sarthakdev143.beat_cutter.dto;

import github.sarthakdev143.beat_cutter.model.ProgressEvent;

public record ProgressUpdateEvent(
        String type,
        String phase,
        String step,
        double percent,
        double elapsedTime,
        double estimatedTimeLeft,
        double overallPercent,
        double overallElapsedTime) implements ChannelEvent {

    public static ProgressUpdateEvent from(ProgressEvent event) {
        return new ProgressUpdateEvent(
                "progress-update",
                event.phase().clientPhase(),
                event.phase().wireName(),
                event.percent(),
                event.elapsedSeconds(),
                event.etaSeconds(),
                event.overallPercent(),
                event.overallElapsedSeconds());
    }
}
