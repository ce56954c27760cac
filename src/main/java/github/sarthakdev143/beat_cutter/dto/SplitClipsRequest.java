package github.sarthakdev143.beat_cutter.dto;

import java.util.List;

public record SplitClipsRequest(
        List<VideoFileReference> videoFiles,
        double clipDurationSeconds,
        String resolution) {

    public SplitClipsRequest {
        videoFiles = videoFiles == null ? List.of() : List.copyOf(videoFiles);
        if (videoFiles.isEmpty()) {
            throw new IllegalArgumentException("No video files uploaded.");
        }
        requireValidClipDuration(clipDurationSeconds);
    }

    public static double requireValidClipDuration(Double clipDurationSeconds) {
        if (clipDurationSeconds == null || !Double.isFinite(clipDurationSeconds) || clipDurationSeconds <= 0.0) {
            throw new IllegalArgumentException("Invalid clip duration.");
        }
        return clipDurationSeconds;
    }
}
