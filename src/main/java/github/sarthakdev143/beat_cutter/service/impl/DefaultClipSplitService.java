package github.sarthakdev143.beat_cutter.service.impl;

import github.sarthakdev143.beat_cutter.config.BeatCutterProperties;
import github.sarthakdev143.beat_cutter.dto.ClipProgressEvent;
import github.sarthakdev143.beat_cutter.dto.SplitClip;
import github.sarthakdev143.beat_cutter.dto.SplitClipsRequest;
import github.sarthakdev143.beat_cutter.dto.SplitClipsResponse;
import github.sarthakdev143.beat_cutter.dto.StatusEvent;
import github.sarthakdev143.beat_cutter.dto.VideoFileReference;
import github.sarthakdev143.beat_cutter.model.OutputResolution;
import github.sarthakdev143.beat_cutter.model.TargetFormat;
import github.sarthakdev143.beat_cutter.progress.ClientChannel;
import github.sarthakdev143.beat_cutter.progress.ClientChannelRegistry;
import github.sarthakdev143.beat_cutter.service.ClipSplitService;
import github.sarthakdev143.beat_cutter.service.ClipSplitter;
import github.sarthakdev143.beat_cutter.service.MediaProber;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspace;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspaceManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Splits each video into {@code floor(duration / clipDuration)} clips at the target resolution. A
 * trailing remainder shorter than one clip is dropped. Clips are rendered in a scratch workspace and
 * only published to the clips directory once every cut has succeeded.
 */
@Service
public class DefaultClipSplitService implements ClipSplitService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultClipSplitService.class);
    private static final Pattern SPLIT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9-]{1,64}$");
    private static final Pattern CLIP_NAME_PATTERN = Pattern.compile("^clip_\\d+_\\d+\\.mp4$");

    private final UploadStorageService uploadStorage;
    private final SessionWorkspaceManager workspaceManager;
    private final MediaProber mediaProber;
    private final ClipSplitter clipSplitter;
    private final ClientChannelRegistry channelRegistry;
    private final MeterRegistry meterRegistry;
    private final Path clipsRoot;
    private final Counter clipsGeneratedCounter;

    @Autowired
    public DefaultClipSplitService(
            UploadStorageService uploadStorage,
            SessionWorkspaceManager workspaceManager,
            MediaProber mediaProber,
            ClipSplitter clipSplitter,
            ClientChannelRegistry channelRegistry,
            MeterRegistry meterRegistry,
            BeatCutterProperties properties) {
        this(uploadStorage, workspaceManager, mediaProber, clipSplitter, channelRegistry, meterRegistry,
                properties.outputDir().resolve("clips"));
    }

    DefaultClipSplitService(
            UploadStorageService uploadStorage,
            SessionWorkspaceManager workspaceManager,
            MediaProber mediaProber,
            ClipSplitter clipSplitter,
            ClientChannelRegistry channelRegistry,
            MeterRegistry meterRegistry,
            Path clipsRoot) {
        this.uploadStorage = uploadStorage;
        this.workspaceManager = workspaceManager;
        this.mediaProber = mediaProber;
        this.clipSplitter = clipSplitter;
        this.channelRegistry = channelRegistry;
        this.meterRegistry = meterRegistry;
        this.clipsRoot = clipsRoot.toAbsolutePath().normalize();
        this.clipsGeneratedCounter = meterRegistry.counter("beat_cutter.clips.generated");
    }

    @Override
    public SplitClipsResponse split(SplitClipsRequest request, String clientId) throws IOException, InterruptedException {
        TargetFormat targetFormat = TargetFormat.forResolution(OutputResolution.fromInput(request.resolution()));
        List<SourceVideo> sources = resolveSources(request.videoFiles());
        String splitId = UUID.randomUUID().toString();
        ClientChannel channel = channelRegistry.channelFor(clientId);
        Path publishDir = clipsRoot.resolve(splitId);

        logger.info(
                "Splitting {} videos into {}s clips at {} split={}",
                sources.size(),
                request.clipDurationSeconds(),
                targetFormat.sizeExpression(),
                splitId);
        channel.send(StatusEvent.of("Uploading and validating videos (" + targetFormat.sizeExpression() + ")..."));

        try (SessionWorkspace workspace = workspaceManager.open(splitId)) {
            List<SplitClip> clips = cutAll(sources, request.clipDurationSeconds(), targetFormat, splitId, workspace, channel);
            publish(clips, workspace, publishDir);
            clipsGeneratedCounter.increment(clips.size());
            channel.send(StatusEvent.of("Clips generated successfully!"));
            logger.info("Split {} produced {} clips", splitId, clips.size());
            return SplitClipsResponse.of(splitId, targetFormat.sizeExpression(), clips);
        } catch (IOException | InterruptedException | RuntimeException e) {
            meterRegistry.counter("beat_cutter.splits.failed").increment();
            logger.error("Split {} failed", splitId, e);
            channel.send(StatusEvent.of("Error: " + e.getMessage()));
            try {
                FileSystemUtils.deleteRecursively(publishDir);
            } catch (IOException cleanupError) {
                e.addSuppressed(cleanupError);
            }
            throw e;
        }
    }

    @Override
    public Optional<Path> clipPath(String splitId, String filename) {
        if (splitId == null || !SPLIT_ID_PATTERN.matcher(splitId).matches()
                || filename == null || !CLIP_NAME_PATTERN.matcher(filename).matches()) {
            return Optional.empty();
        }
        Path clip = clipsRoot.resolve(splitId).resolve(filename);
        return Files.isRegularFile(clip) ? Optional.of(clip) : Optional.empty();
    }

    private List<SourceVideo> resolveSources(List<VideoFileReference> references) {
        List<SourceVideo> sources = new ArrayList<>(references.size());
        for (VideoFileReference reference : references) {
            if (reference.filename() == null || reference.filename().isBlank()) {
                throw new IllegalArgumentException("Every video file needs a filename.");
            }
            Path path = uploadStorage.resolve(reference.filename());
            if (!Files.isRegularFile(path)) {
                throw new IllegalArgumentException("Video file not found: " + reference.filename());
            }
            String originalName = reference.originalName() == null || reference.originalName().isBlank()
                    ? reference.filename()
                    : reference.originalName();
            sources.add(new SourceVideo(path, originalName));
        }
        return sources;
    }

    private List<SplitClip> cutAll(
            List<SourceVideo> sources,
            double clipDuration,
            TargetFormat targetFormat,
            String splitId,
            SessionWorkspace workspace,
            ClientChannel channel) throws IOException, InterruptedException {
        int[] clipCounts = new int[sources.size()];
        int totalClips = 0;
        for (int i = 0; i < sources.size(); i++) {
            double duration = mediaProber.probe(sources.get(i).path()).durationSeconds();
            clipCounts[i] = (int) Math.floor(duration / clipDuration);
            totalClips += clipCounts[i];
        }
        channel.send(ClipProgressEvent.of(totalClips, 0, "", 0, sources.size()));

        List<SplitClip> clips = new ArrayList<>(totalClips);
        for (int i = 0; i < sources.size(); i++) {
            SourceVideo source = sources.get(i);
            channel.send(StatusEvent.of(
                    "Processing video " + (i + 1) + "/" + sources.size() + ": " + source.originalName()));
            channel.send(ClipProgressEvent.of(totalClips, clips.size(), source.originalName(), i + 1, sources.size()));

            for (int j = 0; j < clipCounts[i]; j++) {
                String filename = "clip_" + i + "_" + j + ".mp4";
                double start = j * clipDuration;
                channel.send(StatusEvent.of(
                        "Generating clip " + (j + 1) + "/" + clipCounts[i] + " from " + source.originalName()));
                clipSplitter.cut(source.path(), start, clipDuration, targetFormat, workspace.resolve(filename));
                clips.add(new SplitClip(
                        filename,
                        source.originalName(),
                        start,
                        "/api/clips/" + splitId + "/" + filename));
                channel.send(ClipProgressEvent.of(totalClips, clips.size(), source.originalName(), i + 1, sources.size()));
            }
        }
        return clips;
    }

    private void publish(List<SplitClip> clips, SessionWorkspace workspace, Path publishDir) throws IOException {
        Files.createDirectories(publishDir);
        for (SplitClip clip : clips) {
            Files.move(workspace.resolve(clip.filename()), publishDir.resolve(clip.filename()));
        }
    }

    private record SourceVideo(Path path, String originalName) {
    }
}
