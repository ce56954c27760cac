package github.sarthakdev143.beat_cutter.dto;

public record VideoFileReference(String filename, String originalName) {
}
