package github.sarthakdev143.beat_cutter.dto;

public record SplitClip(
        String filename,
        String originalName,
        double startSeconds,
        String downloadUrl) {
}
