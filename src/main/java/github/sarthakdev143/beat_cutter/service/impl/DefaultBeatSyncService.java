package github.sarthakdev143.beat_cutter.service.impl;

import github.sarthakdev143.beat_cutter.config.BeatCutterConfiguration;
import github.sarthakdev143.beat_cutter.config.BeatCutterProperties;
import github.sarthakdev143.beat_cutter.dto.ProcessSessionRequest;
import github.sarthakdev143.beat_cutter.dto.VideoFileReference;
import github.sarthakdev143.beat_cutter.exception.ClipAssignmentException;
import github.sarthakdev143.beat_cutter.model.AssetValidationResult;
import github.sarthakdev143.beat_cutter.model.BeatTrack;
import github.sarthakdev143.beat_cutter.model.ClipAssignment;
import github.sarthakdev143.beat_cutter.model.MediaAsset;
import github.sarthakdev143.beat_cutter.model.OutputResolution;
import github.sarthakdev143.beat_cutter.model.RenderedSegment;
import github.sarthakdev143.beat_cutter.model.SessionState;
import github.sarthakdev143.beat_cutter.model.SessionStatus;
import github.sarthakdev143.beat_cutter.model.TargetFormat;
import github.sarthakdev143.beat_cutter.progress.ClientChannelRegistry;
import github.sarthakdev143.beat_cutter.progress.ProcessingPhase;
import github.sarthakdev143.beat_cutter.progress.SessionProgressReporter;
import github.sarthakdev143.beat_cutter.service.BeatSyncService;
import github.sarthakdev143.beat_cutter.service.SegmentRenderer;
import github.sarthakdev143.beat_cutter.service.TimelineAssembler;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspace;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspaceManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class DefaultBeatSyncService implements BeatSyncService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultBeatSyncService.class);

    private final UploadStorageService uploadStorage;
    private final SessionWorkspaceManager workspaceManager;
    private final AssetConformanceValidator assetValidator;
    private final ClipAssignmentEngine assignmentEngine;
    private final SegmentRenderer segmentRenderer;
    private final TimelineAssembler timelineAssembler;
    private final ClientChannelRegistry channelRegistry;
    private final TaskExecutor taskExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Path outputDir;
    private final double tailIntervalSeconds;
    private final Duration sessionRetention;
    private final Map<String, SessionStatus> sessions = new ConcurrentHashMap<>();
    private final Counter submittedCounter;
    private final Counter completedCounter;
    private final Counter extendedSegmentCounter;
    private final Counter underrunSegmentCounter;

    public DefaultBeatSyncService(
            UploadStorageService uploadStorage,
            SessionWorkspaceManager workspaceManager,
            AssetConformanceValidator assetValidator,
            ClipAssignmentEngine assignmentEngine,
            SegmentRenderer segmentRenderer,
            TimelineAssembler timelineAssembler,
            ClientChannelRegistry channelRegistry,
            @Qualifier(BeatCutterConfiguration.SESSION_TASK_EXECUTOR) TaskExecutor taskExecutor,
            MeterRegistry meterRegistry,
            Clock clock,
            BeatCutterProperties properties) {
        this.uploadStorage = uploadStorage;
        this.workspaceManager = workspaceManager;
        this.assetValidator = assetValidator;
        this.assignmentEngine = assignmentEngine;
        this.segmentRenderer = segmentRenderer;
        this.timelineAssembler = timelineAssembler;
        this.channelRegistry = channelRegistry;
        this.taskExecutor = taskExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.outputDir = properties.outputDir().toAbsolutePath().normalize();
        this.tailIntervalSeconds = properties.tailIntervalSeconds();
        this.sessionRetention = properties.sessionRetention();
        this.submittedCounter = meterRegistry.counter("beat_cutter.sessions.submitted");
        this.completedCounter = meterRegistry.counter("beat_cutter.sessions.completed");
        this.extendedSegmentCounter = meterRegistry.counter("beat_cutter.segments.extended");
        this.underrunSegmentCounter = meterRegistry.counter("beat_cutter.segments.underrun");
    }

    @Override
    public String submitSession(ProcessSessionRequest request, String clientId) {
        SessionPlan plan = buildPlan(request);
        evictExpiredSessions();
        String sessionId = UUID.randomUUID().toString();

        sessions.put(sessionId, new SessionStatus(
                sessionId,
                SessionState.QUEUED,
                "Session queued.",
                clock.instant(),
                clock.instant(),
                plan.resolution(),
                plan.randomized(),
                List.of(),
                List.of(),
                List.of(),
                null));
        logger.info(
                "Accepted session {} clips={} beats={} resolution={} randomized={}",
                sessionId,
                plan.assets().size(),
                plan.beatTrack().beats().size(),
                plan.resolution(),
                plan.randomized());

        try {
            taskExecutor.execute(() -> processSession(sessionId, clientId, plan));
        } catch (TaskRejectedException e) {
            sessions.remove(sessionId);
            throw new IllegalStateException("Too many sessions in progress. Try again later.", e);
        }
        submittedCounter.increment();
        return sessionId;
    }

    @Override
    public Optional<SessionStatus> getSessionStatus(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Path outputPath(String sessionId) {
        return outputDir.resolve("final_" + sessionId + ".mp4");
    }

    private SessionPlan buildPlan(ProcessSessionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required.");
        }
        if (request.audioFile() == null || request.audioFile().isBlank()) {
            throw new IllegalArgumentException("audioFile is required.");
        }
        if (request.videoFiles().isEmpty()) {
            throw new IllegalArgumentException("videoFiles must contain at least one file.");
        }

        BeatTrack beatTrack = new BeatTrack(request.beats());
        OutputResolution resolution = OutputResolution.fromInput(request.resolution());
        Path audioPath = uploadStorage.resolve(request.audioFile());
        if (!Files.isRegularFile(audioPath)) {
            throw new IllegalArgumentException("Audio file not found: " + request.audioFile());
        }

        List<MediaAsset> assets = new ArrayList<>();
        for (VideoFileReference reference : request.videoFiles()) {
            if (reference.filename() == null || reference.filename().isBlank()) {
                throw new IllegalArgumentException("Every video file needs a filename.");
            }
            String originalName = reference.originalName() == null || reference.originalName().isBlank()
                    ? reference.filename()
                    : reference.originalName();
            assets.add(MediaAsset.pending(reference.filename(), originalName, uploadStorage.resolve(reference.filename())));
        }

        return new SessionPlan(
                List.copyOf(assets),
                audioPath,
                beatTrack,
                resolution,
                TargetFormat.forResolution(resolution),
                request.randomized());
    }

    private void processSession(String sessionId, String clientId, SessionPlan plan) {
        SessionProgressReporter progress = new SessionProgressReporter(channelRegistry.channelFor(clientId), clock);
        Path finalPath = outputPath(sessionId);
        updateSession(sessionId, SessionState.PROCESSING, "Processing started.", Function.identity());
        progress.status("Starting video processing...");

        try (SessionWorkspace workspace = workspaceManager.open(sessionId)) {
            List<String> warnings = runPipeline(sessionId, plan, workspace, progress, finalPath);
            markSessionCompleted(sessionId, finalPath, warnings);
            completedCounter.increment();
            progress.status("Video processing complete!");
            logger.info("Completed session {} output={} warnings={}", sessionId, finalPath.getFileName(), warnings.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failSession(sessionId, progress, "interrupted", "Processing was interrupted.", e);
        } catch (ClipAssignmentException e) {
            failSession(sessionId, progress, "assignment", e.getMessage(), e);
        } catch (Exception e) {
            String stage = progress.currentPhase() == null ? "setup" : progress.currentPhase().wireName();
            failSession(sessionId, progress, stage, e.getMessage(), e);
        }
    }

    private List<String> runPipeline(
            String sessionId,
            SessionPlan plan,
            SessionWorkspace workspace,
            SessionProgressReporter progress,
            Path finalPath) throws IOException, InterruptedException {
        List<MediaAsset> validated = assetValidator.validate(plan.assets(), plan.targetFormat(), workspace, progress);
        List<AssetValidationResult> validationResults = validated.stream().map(AssetValidationResult::of).toList();
        List<MediaAsset> pool = validated.stream().filter(MediaAsset::valid).toList();
        updateSession(sessionId, SessionState.PROCESSING,
                "Validation complete: " + pool.size() + "/" + validated.size() + " files are valid.",
                current -> withValidationResults(current, validationResults));
        Map<String, MediaAsset> poolById = pool.stream()
                .collect(Collectors.toMap(MediaAsset::id, Function.identity(), (first, second) -> first));

        List<Double> intervals = plan.beatTrack().intervals(tailIntervalSeconds);
        List<ClipAssignment> assignments = assignmentEngine.assign(intervals, pool, plan.randomized());
        updateSession(sessionId, SessionState.PROCESSING, "Clips assigned to " + intervals.size() + " beat intervals.",
                current -> withAssignments(current, assignments));

        List<String> warnings = new ArrayList<>();
        List<Path> segments = new ArrayList<>(assignments.size());
        progress.beginPhase(ProcessingPhase.TRIM, assignments.size());
        for (ClipAssignment assignment : assignments) {
            MediaAsset asset = poolById.get(assignment.assetId());
            progress.status("Trimming clip " + (assignment.intervalIndex() + 1) + "/" + assignments.size()
                    + ": " + asset.originalName());

            RenderedSegment segment = segmentRenderer.render(
                    asset,
                    assignment.intervalDurationSeconds(),
                    plan.targetFormat(),
                    workspace,
                    assignment.intervalIndex());
            if (segment.extended()) {
                extendedSegmentCounter.increment();
            }
            if (segment.isUnderrun()) {
                underrunSegmentCounter.increment();
                String warning = String.format(
                        Locale.ROOT,
                        "Interval %d is %.3fs shorter than its beat: clip %s is too short even when looped in reverse.",
                        assignment.intervalIndex() + 1,
                        segment.underrunSeconds(),
                        asset.originalName());
                warnings.add(warning);
                progress.status("Warning: " + warning);
            }
            segments.add(segment.path());
            progress.unitCompleted();
        }

        progress.beginPhase(ProcessingPhase.CONCAT, 1);
        progress.status("Merging video clips...");
        Path mergedPath = timelineAssembler.concatenate(segments, workspace);
        progress.unitCompleted();

        progress.beginPhase(ProcessingPhase.MUX, 1);
        progress.status("Adding original audio track...");
        timelineAssembler.muxAudio(mergedPath, plan.audioPath(), finalPath);
        progress.unitCompleted();

        progress.complete();
        return warnings;
    }

    private void failSession(
            String sessionId,
            SessionProgressReporter progress,
            String stage,
            String reason,
            Exception error) {
        String message = "Failed to process videos: " + reason;
        logger.error("Session {} failed during {}", sessionId, stage, error);
        meterRegistry.counter("beat_cutter.sessions.failed", "phase", stage).increment();
        deleteQuietly(outputPath(sessionId));
        progress.status("Error: " + reason);
        updateSession(sessionId, SessionState.FAILED, message, Function.identity());
    }

    private void markSessionCompleted(String sessionId, Path finalPath, List<String> warnings) {
        String message = warnings.isEmpty()
                ? "Video processing complete."
                : "Video processing complete with warnings.";
        sessions.computeIfPresent(sessionId, (ignored, current) -> new SessionStatus(
                current.sessionId(),
                SessionState.COMPLETED,
                message,
                current.createdAt(),
                clock.instant(),
                current.resolution(),
                current.randomized(),
                current.validationResults(),
                current.assignments(),
                warnings,
                finalPath.getFileName().toString()));
    }

    private void updateSession(
            String sessionId,
            SessionState state,
            String message,
            Function<SessionStatus, SessionStatus> change) {
        sessions.computeIfPresent(sessionId, (ignored, current) -> {
            SessionStatus changed = change.apply(current);
            return new SessionStatus(
                    changed.sessionId(),
                    state,
                    message,
                    changed.createdAt(),
                    clock.instant(),
                    changed.resolution(),
                    changed.randomized(),
                    changed.validationResults(),
                    changed.assignments(),
                    changed.warnings(),
                    changed.outputFile());
        });
    }

    private SessionStatus withAssignments(SessionStatus current, List<ClipAssignment> assignments) {
        return new SessionStatus(
                current.sessionId(),
                current.state(),
                current.message(),
                current.createdAt(),
                current.updatedAt(),
                current.resolution(),
                current.randomized(),
                current.validationResults(),
                assignments,
                current.warnings(),
                current.outputFile());
    }

    private SessionStatus withValidationResults(SessionStatus current, List<AssetValidationResult> validationResults) {
        return new SessionStatus(
                current.sessionId(),
                current.state(),
                current.message(),
                current.createdAt(),
                current.updatedAt(),
                current.resolution(),
                current.randomized(),
                validationResults,
                current.assignments(),
                current.warnings(),
                current.outputFile());
    }

    /**
     * Forgets finished sessions whose last update is older than the retention window and removes
     * their output files. Queued and running sessions are never evicted.
     */
    void evictExpiredSessions() {
        Instant cutoff = clock.instant().minus(sessionRetention);
        sessions.values().removeIf(status -> {
            if (!status.terminal() || !status.updatedAt().isBefore(cutoff)) {
                return false;
            }
            deleteQuietly(outputPath(status.sessionId()));
            logger.info("Evicted session {} last updated at {}", status.sessionId(), status.updatedAt());
            return true;
        });
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete output {}", path, e);
        }
    }

    private record SessionPlan(
            List<MediaAsset> assets,
            Path audioPath,
            BeatTrack beatTrack,
            OutputResolution resolution,
            TargetFormat targetFormat,
            boolean randomized) {
    }
}
