package github.sarthakdev143.beat_cutter.model;

import java.nio.file.Path;

/**
 * Output of rendering one interval. {@code availableDurationSeconds} is the source length the
 * segment was cut from, doubled when the reverse-loop extension was applied.
 */
public record RenderedSegment(
        Path path,
        double requestedDurationSeconds,
        double availableDurationSeconds,
        boolean extended) {

    public double underrunSeconds() {
        return Math.max(0.0, requestedDurationSeconds - availableDurationSeconds);
    }

    public boolean isUnderrun() {
        return underrunSeconds() > 1e-9;
    }
}
