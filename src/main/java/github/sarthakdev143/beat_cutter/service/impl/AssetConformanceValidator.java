package github.sarthakdev143.beat_cutter.service.impl;

import github.sarthakdev143.beat_cutter.model.MediaAsset;
import github.sarthakdev143.beat_cutter.model.MediaMetadata;
import github.sarthakdev143.beat_cutter.model.TargetFormat;
import github.sarthakdev143.beat_cutter.progress.ProcessingPhase;
import github.sarthakdev143.beat_cutter.progress.SessionProgressReporter;
import github.sarthakdev143.beat_cutter.service.MediaProber;
import github.sarthakdev143.beat_cutter.service.MediaStandardizer;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspace;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Validation phase: probes every uploaded clip, re-encodes non-conforming clips into the session
 * workspace, and marks unusable clips invalid without failing the batch.
 */
@Component
public class AssetConformanceValidator {

    private static final Logger logger = LoggerFactory.getLogger(AssetConformanceValidator.class);

    private final MediaProber mediaProber;
    private final MediaStandardizer mediaStandardizer;
    private final Counter invalidAssetCounter;
    private final Counter standardizedAssetCounter;

    public AssetConformanceValidator(
            MediaProber mediaProber,
            MediaStandardizer mediaStandardizer,
            MeterRegistry meterRegistry) {
        this.mediaProber = mediaProber;
        this.mediaStandardizer = mediaStandardizer;
        this.invalidAssetCounter = meterRegistry.counter("beat_cutter.assets.invalid");
        this.standardizedAssetCounter = meterRegistry.counter("beat_cutter.assets.standardized");
    }

    public List<MediaAsset> validate(
            List<MediaAsset> assets,
            TargetFormat targetFormat,
            SessionWorkspace workspace,
            SessionProgressReporter progress) throws InterruptedException {
        progress.status("Validating and standardizing video files to " + targetFormat.sizeExpression() + "...");
        progress.beginPhase(ProcessingPhase.VALIDATION, Math.max(assets.size(), 1));

        List<MediaAsset> results = new ArrayList<>(assets.size());
        for (int index = 0; index < assets.size(); index++) {
            MediaAsset asset = assets.get(index);
            progress.status("Checking file " + (index + 1) + "/" + assets.size() + ": " + asset.originalName());
            results.add(validateOne(asset, index, assets.size(), targetFormat, workspace, progress));
            progress.unitCompleted();
        }

        long validCount = results.stream().filter(MediaAsset::valid).count();
        progress.status("Validation complete: " + validCount + "/" + assets.size() + " files are valid");
        return List.copyOf(results);
    }

    private MediaAsset validateOne(
            MediaAsset asset,
            int index,
            int total,
            TargetFormat targetFormat,
            SessionWorkspace workspace,
            SessionProgressReporter progress) throws InterruptedException {
        Path standardizedPath = workspace.resolve("standardized_" + index + ".mp4");
        try {
            if (!Files.exists(asset.storagePath())) {
                return markInvalid(asset, "File not found: " + asset.originalName());
            }

            MediaMetadata metadata = mediaProber.probe(asset.storagePath());
            if (!targetFormat.requiresReencode(metadata)) {
                return asset.validated(metadata.durationSeconds());
            }

            progress.status("Standardizing file " + (index + 1) + "/" + total + ": " + asset.originalName());
            mediaStandardizer.standardize(asset.storagePath(), targetFormat, standardizedPath);
            standardizedAssetCounter.increment();
            MediaMetadata standardized = mediaProber.probe(standardizedPath);
            logger.info(
                    "Standardized {} from {}x{}@{} {} to {}",
                    asset.originalName(),
                    metadata.width(),
                    metadata.height(),
                    metadata.frameRate(),
                    metadata.videoCodec(),
                    targetFormat.sizeExpression());
            return asset.withStandardizedCopy(standardizedPath, standardized.durationSeconds());
        } catch (IOException e) {
            workspace.discard(standardizedPath);
            return markInvalid(asset, e.getMessage());
        }
    }

    private MediaAsset markInvalid(MediaAsset asset, String reason) {
        invalidAssetCounter.increment();
        logger.warn("Asset {} ({}) is invalid: {}", asset.id(), asset.originalName(), reason);
        return asset.invalid(reason);
    }
}
