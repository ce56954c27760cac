package github.sarthakdev143.beat_cutter.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ascending beat timestamps in seconds. Yields one interval per beat: the gaps between consecutive
 * beats plus a fixed-length tail after the last beat.
 */
public record BeatTrack(List<Double> beats) {

    public static final double DEFAULT_TAIL_SECONDS = 2.0;

    public BeatTrack {
        if (beats == null || beats.size() < 2) {
            throw new IllegalArgumentException("beats must contain at least 2 timestamps.");
        }
        beats = List.copyOf(beats);
        for (int index = 0; index < beats.size(); index++) {
            double beat = beats.get(index);
            if (!Double.isFinite(beat) || beat < 0.0) {
                throw new IllegalArgumentException("beats[" + index + "] must be a finite, non-negative number.");
            }
            if (index > 0 && beat <= beats.get(index - 1)) {
                throw new IllegalArgumentException("beats must be strictly increasing (index " + index + ").");
            }
        }
    }

    public List<Double> intervals() {
        return intervals(DEFAULT_TAIL_SECONDS);
    }

    public List<Double> intervals(double tailSeconds) {
        if (tailSeconds <= 0.0) {
            throw new IllegalArgumentException("Tail interval must be positive.");
        }
        List<Double> intervals = new ArrayList<>(beats.size());
        for (int index = 0; index < beats.size() - 1; index++) {
            intervals.add(beats.get(index + 1) - beats.get(index));
        }
        intervals.add(tailSeconds);
        return List.copyOf(intervals);
    }
}
