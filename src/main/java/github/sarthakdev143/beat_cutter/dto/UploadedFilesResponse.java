package github.sarthakdev143.beat_cutter.dto;

import java.util.List;

public record UploadedFilesResponse(List<UploadedFileResponse> files, int count) {

    public UploadedFilesResponse {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static UploadedFilesResponse of(List<UploadedFileResponse> files) {
        return new UploadedFilesResponse(files, files == null ? 0 : files.size());
    }
}
