package github.sarthakdev143.beat_cutter.dto;

/**
 * Clip-count progress of a split request. Unlike {@link ProgressUpdateEvent} it carries no time
 * estimates.
 */
public record ClipProgressEvent(
        String type,
        int totalClips,
        int processedClips,
        String currentVideo,
        int currentVideoIndex,
        int totalVideos) implements ChannelEvent {

    public static ClipProgressEvent of(
            int totalClips,
            int processedClips,
            String currentVideo,
            int currentVideoIndex,
            int totalVideos) {
        return new ClipProgressEvent("progress", totalClips, processedClips, currentVideo, currentVideoIndex, totalVideos);
    }
}
