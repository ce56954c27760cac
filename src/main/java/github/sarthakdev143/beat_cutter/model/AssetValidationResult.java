package github.sarthakdev143.beat_cutter.model;

/**
 * Per-file outcome of the validation phase as reported to clients.
 */
public record AssetValidationResult(
        String filename,
        String originalName,
        boolean valid,
        String error,
        double durationSeconds) {

    public static AssetValidationResult of(MediaAsset asset) {
        return new AssetValidationResult(
                asset.id(),
                asset.originalName(),
                asset.valid(),
                asset.validationError(),
                asset.durationSeconds());
    }
}
