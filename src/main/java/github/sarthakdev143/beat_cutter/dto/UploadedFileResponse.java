package github.sarthakdev143.beat_cutter.dto;

public record UploadedFileResponse(
        String filename,
        String originalName,
        long size) {
}
