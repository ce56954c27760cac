package github.sarthakdev143.beat_cutter.progress;

import java.time.Duration;

/**
 * Pipeline phases in execution order. Each phase owns a fixed band of the overall 0-100 range and
 * an a-priori cost per unit of work used for time estimates before real timings exist.
 *
 * <p>Clients only distinguish {@code validation} from {@code processing}; {@link #wireName()} is the
 * finer step sent alongside it.
 */
public enum ProcessingPhase {
    VALIDATION("validation", "validation", 0.0, 50.0, Duration.ofSeconds(5)),
    TRIM("processing", "trim", 50.0, 90.0, Duration.ofSeconds(10)),
    CONCAT("processing", "concat", 90.0, 95.0, Duration.ofSeconds(20)),
    MUX("processing", "mux", 95.0, 100.0, Duration.ofSeconds(10)),
    DONE("processing", "done", 100.0, 100.0, Duration.ZERO);

    private final String clientPhase;
    private final String wireName;
    private final double overallStart;
    private final double overallEnd;
    private final Duration estimatedUnitCost;

    ProcessingPhase(
            String clientPhase,
            String wireName,
            double overallStart,
            double overallEnd,
            Duration estimatedUnitCost) {
        this.clientPhase = clientPhase;
        this.wireName = wireName;
        this.overallStart = overallStart;
        this.overallEnd = overallEnd;
        this.estimatedUnitCost = estimatedUnitCost;
    }

    public String clientPhase() {
        return clientPhase;
    }

    public String wireName() {
        return wireName;
    }

    public double overallStart() {
        return overallStart;
    }

    public double overallEnd() {
        return overallEnd;
    }

    public Duration estimatedUnitCost() {
        return estimatedUnitCost;
    }

    public double toOverallPercent(double phasePercent) {
        return overallStart + (overallEnd - overallStart) * phasePercent / 100.0;
    }
}
