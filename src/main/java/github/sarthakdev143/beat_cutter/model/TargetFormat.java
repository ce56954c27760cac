package github.sarthakdev143.beat_cutter.model;

import java.util.Objects;

/**
 * Encode settings every rendered segment conforms to, so that segments can be joined by stream copy.
 */
public record TargetFormat(
        int width,
        int height,
        FrameRate frameRate,
        String videoCodec,
        String audioCodec) {

    public static final FrameRate DEFAULT_FRAME_RATE = FrameRate.of(24);
    public static final String DEFAULT_VIDEO_CODEC = "h264";
    public static final String DEFAULT_AUDIO_CODEC = "aac";

    public TargetFormat {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target width and height must be positive.");
        }
        Objects.requireNonNull(frameRate, "frameRate");
        Objects.requireNonNull(videoCodec, "videoCodec");
        Objects.requireNonNull(audioCodec, "audioCodec");
    }

    public static TargetFormat forResolution(OutputResolution resolution) {
        return new TargetFormat(
                resolution.width(),
                resolution.height(),
                DEFAULT_FRAME_RATE,
                DEFAULT_VIDEO_CODEC,
                DEFAULT_AUDIO_CODEC);
    }

    public boolean requiresReencode(MediaMetadata metadata) {
        return metadata.width() != width
                || metadata.height() != height
                || !frameRate.equals(metadata.frameRate())
                || !videoCodec.equals(metadata.videoCodec())
                || (metadata.hasAudio() && !audioCodec.equals(metadata.audioCodec()));
    }

    public String sizeExpression() {
        return width + "x" + height;
    }
}
