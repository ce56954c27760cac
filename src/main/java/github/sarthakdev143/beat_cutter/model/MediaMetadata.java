package github.sarthakdev143.beat_cutter.model;

public record MediaMetadata(
        double durationSeconds,
        int width,
        int height,
        FrameRate frameRate,
        String videoCodec,
        String audioCodec) {

    public boolean hasAudio() {
        return audioCodec != null;
    }
}
