package github.sarthakdev143.beat_cutter.dto;

import java.util.List;

public record SplitClipsResponse(String splitId, String resolution, List<SplitClip> clips, int count) {

    public SplitClipsResponse {
        clips = clips == null ? List.of() : List.copyOf(clips);
    }

    public static SplitClipsResponse of(String splitId, String resolution, List<SplitClip> clips) {
        return new SplitClipsResponse(splitId, resolution, clips, clips == null ? 0 : clips.size());
    }
}
