package github.sarthakdev143.beat_cutter.progress;

import github.sarthakdev143.beat_cutter.dto.ProgressUpdateEvent;
import github.sarthakdev143.beat_cutter.dto.StatusEvent;
import github.sarthakdev143.beat_cutter.model.ProgressEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Progress state machine for one session. Phases advance strictly in {@link ProcessingPhase}
 * order; every completed unit of work produces a {@link ProgressEvent} on the client channel.
 *
 * <p>Figures are advisory. Nothing in the pipeline reads them back.
 */
public class SessionProgressReporter {

    private final ClientChannel channel;
    private final Clock clock;
    private final Instant sessionStart;

    private ProcessingPhase phase;
    private Instant phaseStart;
    private int totalUnits;
    private int completedUnits;

    public SessionProgressReporter(ClientChannel channel, Clock clock) {
        this.channel = channel;
        this.clock = clock;
        this.sessionStart = clock.instant();
    }

    public ProcessingPhase currentPhase() {
        return phase;
    }

    public void status(String message) {
        channel.send(StatusEvent.of(message));
    }

    public ProgressEvent beginPhase(ProcessingPhase nextPhase, int units) {
        if (nextPhase == ProcessingPhase.DONE) {
            throw new IllegalArgumentException("Use complete() to finish the session.");
        }
        if (units <= 0) {
            throw new IllegalArgumentException("A phase needs at least one unit of work.");
        }
        advanceTo(nextPhase);
        this.totalUnits = units;
        this.completedUnits = 0;
        return emit();
    }

    public ProgressEvent unitCompleted() {
        if (phase == null || phase == ProcessingPhase.DONE) {
            throw new IllegalStateException("No phase is in progress.");
        }
        if (completedUnits >= totalUnits) {
            throw new IllegalStateException("All " + totalUnits + " units of phase " + phase.wireName() + " already completed.");
        }
        completedUnits++;
        return emit();
    }

    public ProgressEvent complete() {
        advanceTo(ProcessingPhase.DONE);
        this.totalUnits = 1;
        this.completedUnits = 1;
        return emit();
    }

    private void advanceTo(ProcessingPhase nextPhase) {
        if (phase != null && nextPhase.ordinal() <= phase.ordinal()) {
            throw new IllegalStateException(
                    "Cannot move from phase " + phase.wireName() + " to " + nextPhase.wireName() + ".");
        }
        this.phase = nextPhase;
        this.phaseStart = clock.instant();
    }

    private ProgressEvent emit() {
        Instant now = clock.instant();
        double percent = 100.0 * completedUnits / totalUnits;
        double elapsedSeconds = seconds(Duration.between(phaseStart, now));
        ProgressEvent event = new ProgressEvent(
                phase,
                percent,
                elapsedSeconds,
                estimateRemainingSeconds(elapsedSeconds),
                phase.toOverallPercent(percent),
                seconds(Duration.between(sessionStart, now)));
        channel.send(ProgressUpdateEvent.from(event));
        return event;
    }

    private double estimateRemainingSeconds(double elapsedSeconds) {
        int remainingUnits = totalUnits - completedUnits;
        if (remainingUnits <= 0) {
            return 0.0;
        }
        double perUnitSeconds = completedUnits == 0
                ? seconds(phase.estimatedUnitCost())
                : elapsedSeconds / completedUnits;
        return Math.max(0.0, perUnitSeconds * remainingUnits);
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
