package github.sarthakdev143.beat_cutter.model;

public record ClipAssignment(
        int intervalIndex,
        String assetId,
        double intervalDurationSeconds,
        double assetDurationSeconds) {

    public double surplusSeconds() {
        return assetDurationSeconds - intervalDurationSeconds;
    }
}
