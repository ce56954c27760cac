package github.sarthakdev143.beat_cutter.dto;

import java.util.List;

public record ProcessSessionRequest(
        String audioFile,
        List<VideoFileReference> videoFiles,
        List<Double> beats,
        boolean randomized,
        String resolution) {

    public ProcessSessionRequest {
        videoFiles = videoFiles == null ? List.of() : List.copyOf(videoFiles);
        beats = beats == null ? List.of() : List.copyOf(beats);
    }
}
