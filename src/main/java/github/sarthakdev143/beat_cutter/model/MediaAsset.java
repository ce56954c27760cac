package github.sarthakdev143.beat_cutter.model;

import java.nio.file.Path;

/**
 * A source clip offered to the pipeline. Only valid assets may be assigned to intervals.
 */
public record MediaAsset(
        String id,
        String originalName,
        Path storagePath,
        double durationSeconds,
        boolean valid,
        String validationError) {

    public static MediaAsset pending(String id, String originalName, Path storagePath) {
        return new MediaAsset(id, originalName, storagePath, 0.0, false, null);
    }

    public MediaAsset validated(double probedDurationSeconds) {
        return new MediaAsset(id, originalName, storagePath, probedDurationSeconds, true, null);
    }

    public MediaAsset withStandardizedCopy(Path standardizedPath, double probedDurationSeconds) {
        return new MediaAsset(id, originalName, standardizedPath, probedDurationSeconds, true, null);
    }

    public MediaAsset invalid(String reason) {
        return new MediaAsset(id, originalName, storagePath, 0.0, false, reason);
    }
}
