package github.sarthakdev143.beat_cutter.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BeatTrackTest {

    @Test
    void intervalsAreGapsBetweenBeatsPlusDefaultTail() {
        BeatTrack track = new BeatTrack(List.of(0.0, 1.5, 2.5));

        List<Double> intervals = track.intervals();

        assertThat(intervals).hasSize(3);
        assertThat(intervals.get(0)).isCloseTo(1.5, within(1e-9));
        assertThat(intervals.get(1)).isCloseTo(1.0, within(1e-9));
        assertThat(intervals.get(2)).isEqualTo(BeatTrack.DEFAULT_TAIL_SECONDS);
    }

    @Test
    void intervalCountMatchesBeatCount() {
        BeatTrack track = new BeatTrack(List.of(0.2, 0.7, 1.1, 1.9, 3.0));

        assertThat(track.intervals(1.25)).hasSize(5).last().isEqualTo(1.25);
    }

    @Test
    void rejectsFewerThanTwoBeats() {
        assertThatThrownBy(() -> new BeatTrack(List.of(1.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 2");
        assertThatThrownBy(() -> new BeatTrack(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonIncreasingBeats() {
        assertThatThrownBy(() -> new BeatTrack(List.of(0.0, 1.0, 1.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increasing");
        assertThatThrownBy(() -> new BeatTrack(List.of(2.0, 1.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeAndNonFiniteBeats() {
        assertThatThrownBy(() -> new BeatTrack(List.of(-0.5, 1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BeatTrack(Arrays.asList(0.0, Double.NaN)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BeatTrack(Arrays.asList(0.0, Double.POSITIVE_INFINITY)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveTail() {
        BeatTrack track = new BeatTrack(List.of(0.0, 1.0));

        assertThatThrownBy(() -> track.intervals(0.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
