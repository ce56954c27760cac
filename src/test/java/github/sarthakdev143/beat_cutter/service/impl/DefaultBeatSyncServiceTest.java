package github.sarthakdev143.beat_cutter.service.impl;

import github.sarthakdev143.beat_cutter.config.BeatCutterProperties;
import github.sarthakdev143.beat_cutter.dto.ChannelEvent;
import github.sarthakdev143.beat_cutter.dto.ProcessSessionRequest;
import github.sarthakdev143.beat_cutter.dto.StatusEvent;
import github.sarthakdev143.beat_cutter.dto.VideoFileReference;
import github.sarthakdev143.beat_cutter.model.AssetValidationResult;
import github.sarthakdev143.beat_cutter.model.ClipAssignment;
import github.sarthakdev143.beat_cutter.model.MediaAsset;
import github.sarthakdev143.beat_cutter.model.OutputResolution;
import github.sarthakdev143.beat_cutter.model.RenderedSegment;
import github.sarthakdev143.beat_cutter.model.SessionState;
import github.sarthakdev143.beat_cutter.model.SessionStatus;
import github.sarthakdev143.beat_cutter.model.TargetFormat;
import github.sarthakdev143.beat_cutter.progress.ClientChannelRegistry;
import github.sarthakdev143.beat_cutter.service.SegmentRenderer;
import github.sarthakdev143.beat_cutter.service.TimelineAssembler;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspace;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspaceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultBeatSyncServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-04T12:00:00Z");
    private static final Map<String, Double> CLIP_DURATIONS = Map.of(
            "videos-long.mp4", 5.0,
            "videos-short.mp4", 2.0,
            "videos-tail.mp4", 3.0,
            "videos-tiny.mp4", 0.5);

    @Mock
    private AssetConformanceValidator assetValidator;

    @Mock
    private SegmentRenderer segmentRenderer;

    @Mock
    private TimelineAssembler timelineAssembler;

    @Mock
    private ClientChannelRegistry channelRegistry;

    @TempDir
    Path tempDir;

    private final List<ChannelEvent> events = new ArrayList<>();
    private SimpleMeterRegistry meterRegistry;
    private BeatCutterProperties properties;
    private DefaultBeatSyncService service;

    @BeforeEach
    void setUp() throws IOException {
        properties = new BeatCutterProperties(
                "ffmpeg",
                "ffprobe",
                Duration.ofMinutes(1),
                tempDir.resolve("uploads"),
                tempDir.resolve("temp"),
                tempDir.resolve("output"),
                2.0,
                1,
                1,
                Duration.ofHours(1),
                List.of());
        Files.createDirectories(properties.uploadsDir());
        Files.writeString(properties.uploadsDir().resolve("audio-song.mp3"), "audio");

        meterRegistry = new SimpleMeterRegistry();
        lenient().when(channelRegistry.channelFor(any())).thenReturn(events::add);
        service = newService(Runnable::run);
    }

    @Test
    void submitSessionCompletesSuccessfully() throws Exception {
        stubValidationKeepsEveryClip();
        stubRenderingMatchesRequestedDuration();

        String sessionId = service.submitSession(
                request(List.of(0.0, 1.0, 3.5), "videos-long.mp4", "videos-short.mp4", "videos-tail.mp4"),
                "client-1");
        SessionStatus status = service.getSessionStatus(sessionId).orElseThrow();

        assertThat(status.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(status.message()).isEqualTo("Video processing complete.");
        assertThat(status.outputFile()).isEqualTo("final_" + sessionId + ".mp4");
        assertThat(status.resolution()).isEqualTo(OutputResolution.FULL_HD);
        assertThat(status.createdAt()).isEqualTo(NOW);
        assertThat(status.warnings()).isEmpty();
        assertThat(status.assignments()).extracting(ClipAssignment::assetId)
                .containsExactly("videos-short.mp4", "videos-tail.mp4", "videos-long.mp4");
        assertThat(events).contains(StatusEvent.of("Video processing complete!"));
        assertThat(meterRegistry.counter("beat_cutter.sessions.submitted").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("beat_cutter.sessions.completed").count()).isEqualTo(1.0);
        assertThat(properties.workspaceRoot().resolve(sessionId)).doesNotExist();
    }

    @Test
    void segmentsAreMergedInIntervalOrderThenMuxedWithTheUploadedAudio() throws Exception {
        stubValidationKeepsEveryClip();
        stubRenderingMatchesRequestedDuration();

        String sessionId = service.submitSession(
                request(List.of(0.0, 1.0, 3.5), "videos-long.mp4", "videos-short.mp4", "videos-tail.mp4"),
                null);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Path>> segments = ArgumentCaptor.forClass(List.class);
        verify(timelineAssembler).concatenate(segments.capture(), any(SessionWorkspace.class));
        assertThat(segments.getValue()).extracting(path -> path.getFileName().toString())
                .containsExactly("trimmed_0.mp4", "trimmed_1.mp4", "trimmed_2.mp4");
        verify(timelineAssembler).muxAudio(
                any(Path.class),
                eq(properties.uploadsDir().toAbsolutePath().normalize().resolve("audio-song.mp3")),
                eq(service.outputPath(sessionId)));
    }

    @Test
    void tooFewValidClipsFailsTheSessionAndRemovesItsWorkspace() throws Exception {
        stubValidationKeepsEveryClip();

        String sessionId = service.submitSession(
                request(List.of(0.0, 1.0, 3.5), "videos-long.mp4", "videos-short.mp4"),
                "client-1");
        SessionStatus status = service.getSessionStatus(sessionId).orElseThrow();

        assertThat(status.state()).isEqualTo(SessionState.FAILED);
        assertThat(status.message()).startsWith("Failed to process videos: No suitable clip available for beat duration");
        assertThat(events).anySatisfy(event -> assertThat(event).isInstanceOfSatisfying(
                StatusEvent.class, statusEvent -> assertThat(statusEvent.message()).startsWith("Error: ")));
        assertThat(meterRegistry.counter("beat_cutter.sessions.failed", "phase", "assignment").count()).isEqualTo(1.0);
        assertThat(properties.workspaceRoot().resolve(sessionId)).doesNotExist();
        verifyNoInteractions(segmentRenderer, timelineAssembler);
    }

    @Test
    void invalidClipsAreLeftOutOfTheAssignmentPool() throws Exception {
        when(assetValidator.validate(anyList(), any(TargetFormat.class), any(SessionWorkspace.class), any()))
                .thenAnswer(invocation -> {
                    List<MediaAsset> assets = invocation.getArgument(0);
                    List<MediaAsset> validated = new ArrayList<>();
                    for (MediaAsset asset : assets) {
                        validated.add(asset.id().equals("videos-long.mp4")
                                ? asset.invalid("No video stream found")
                                : asset.validated(CLIP_DURATIONS.get(asset.id())));
                    }
                    return validated;
                });
        stubRenderingMatchesRequestedDuration();

        String sessionId = service.submitSession(
                request(List.of(0.0, 1.0), "videos-long.mp4", "videos-short.mp4", "videos-tail.mp4"),
                null);

        SessionStatus status = service.getSessionStatus(sessionId).orElseThrow();
        assertThat(status.assignments())
                .extracting(ClipAssignment::assetId)
                .doesNotContain("videos-long.mp4");
        assertThat(status.validationResults()).containsExactly(
                new AssetValidationResult("videos-long.mp4", "videos-long.mp4", false, "No video stream found", 0.0),
                new AssetValidationResult("videos-short.mp4", "videos-short.mp4", true, null, 2.0),
                new AssetValidationResult("videos-tail.mp4", "videos-tail.mp4", true, null, 3.0));
        assertThat(status.validCount()).isEqualTo(2);
    }

    @Test
    void underRunSegmentCompletesWithAWarning() throws Exception {
        stubValidationKeepsEveryClip();
        when(segmentRenderer.render(any(MediaAsset.class), anyDouble(), any(TargetFormat.class), any(SessionWorkspace.class), anyInt()))
                .thenAnswer(invocation -> {
                    MediaAsset asset = invocation.getArgument(0);
                    double target = invocation.getArgument(1);
                    SessionWorkspace workspace = invocation.getArgument(3);
                    int index = invocation.getArgument(4);
                    double available = Math.min(target, asset.durationSeconds() * 2.0);
                    return new RenderedSegment(workspace.resolve("trimmed_" + index + ".mp4"), target, available, true);
                });
        stubAssembly();

        String sessionId = service.submitSession(request(List.of(0.0, 3.0), "videos-tiny.mp4", "videos-short.mp4"), "client-1");
        SessionStatus status = service.getSessionStatus(sessionId).orElseThrow();

        assertThat(status.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(status.message()).isEqualTo("Video processing complete with warnings.");
        assertThat(status.warnings()).singleElement().asString().contains("Interval 1", "videos-tiny.mp4");
        assertThat(meterRegistry.counter("beat_cutter.segments.underrun").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("beat_cutter.segments.extended").count()).isEqualTo(2.0);
    }

    @Test
    void renderFailureFailsTheSessionWithoutMuxing() throws Exception {
        stubValidationKeepsEveryClip();
        when(segmentRenderer.render(any(MediaAsset.class), anyDouble(), any(TargetFormat.class), any(SessionWorkspace.class), anyInt()))
                .thenThrow(new IOException("Command failed during stage trim interval 0 with exit code 1"));

        String sessionId = service.submitSession(request(List.of(0.0, 1.0), "videos-long.mp4", "videos-short.mp4"), null);
        SessionStatus status = service.getSessionStatus(sessionId).orElseThrow();

        assertThat(status.state()).isEqualTo(SessionState.FAILED);
        assertThat(status.message()).contains("trim interval 0");
        assertThat(status.outputFile()).isNull();
        assertThat(meterRegistry.counter("beat_cutter.sessions.failed", "phase", "trim").count()).isEqualTo(1.0);
        assertThat(properties.workspaceRoot().resolve(sessionId)).doesNotExist();
        verify(timelineAssembler, never()).muxAudio(any(), any(), any());
    }

    @Test
    void randomizedFlagAndResolutionAreRecorded() throws Exception {
        stubValidationKeepsEveryClip();
        stubRenderingMatchesRequestedDuration();

        String sessionId = service.submitSession(
                new ProcessSessionRequest(
                        "audio-song.mp3",
                        List.of(new VideoFileReference("videos-long.mp4", "long.mp4"),
                                new VideoFileReference("videos-short.mp4", "short.mp4")),
                        List.of(0.0, 1.0),
                        true,
                        "720p"),
                null);
        SessionStatus status = service.getSessionStatus(sessionId).orElseThrow();

        assertThat(status.randomized()).isTrue();
        assertThat(status.resolution()).isEqualTo(OutputResolution.HD_720P);
        verify(assetValidator).validate(
                anyList(),
                eq(TargetFormat.forResolution(OutputResolution.HD_720P)),
                any(SessionWorkspace.class),
                any());
    }

    @Test
    void submitSessionRejectsInvalidRequests() {
        assertThatThrownBy(() -> service.submitSession(request(List.of(0.0), "videos-long.mp4"), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 2");
        assertThatThrownBy(() -> service.submitSession(request(List.of(0.0, 1.0)), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("videoFiles");
        assertThatThrownBy(() -> service.submitSession(
                new ProcessSessionRequest(null, List.of(new VideoFileReference("videos-a.mp4", null)), List.of(0.0, 1.0), false, null),
                null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("audioFile");
        assertThatThrownBy(() -> service.submitSession(
                new ProcessSessionRequest("missing.mp3", List.of(new VideoFileReference("videos-a.mp4", null)), List.of(0.0, 1.0), false, null),
                null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Audio file not found");
        assertThatThrownBy(() -> service.submitSession(
                new ProcessSessionRequest("audio-song.mp3", List.of(new VideoFileReference("../etc/passwd", null)), List.of(0.0, 1.0), false, null),
                null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.submitSession(
                new ProcessSessionRequest("audio-song.mp3", List.of(new VideoFileReference(" ", null)), List.of(0.0, 1.0), false, null),
                null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs a filename");
        assertThatThrownBy(() -> new ProcessSessionRequest(
                "audio-song.mp3", Arrays.asList((VideoFileReference) null), List.of(0.0, 1.0), false, null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> service.submitSession(
                new ProcessSessionRequest("audio-song.mp3", List.of(new VideoFileReference("videos-a.mp4", null)), List.of(0.0, 1.0), false, "8k"),
                null))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(assetValidator);
    }

    @Test
    void rejectedSubmissionIsReportedAsBusy() {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("queue full");
        };
        DefaultBeatSyncService busyService = newService(saturated);

        assertThatThrownBy(() -> busyService.submitSession(request(List.of(0.0, 1.0), "videos-long.mp4"), null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Too many sessions");
        assertThat(meterRegistry.counter("beat_cutter.sessions.submitted").count()).isZero();
    }

    @Test
    void submittedSessionIsQueuedUntilAWorkerPicksItUp() {
        List<Runnable> pending = new ArrayList<>();
        DefaultBeatSyncService deferred = newService(pending::add);

        String sessionId = deferred.submitSession(request(List.of(0.0, 1.0), "videos-long.mp4"), null);

        assertThat(deferred.getSessionStatus(sessionId).orElseThrow().state()).isEqualTo(SessionState.QUEUED);
        assertThat(pending).hasSize(1);
    }

    @Test
    void finishedSessionsAreEvictedOnceTheRetentionWindowPasses() throws Exception {
        stubValidationKeepsEveryClip();
        stubRenderingMatchesRequestedDuration();
        AdjustableClock clock = new AdjustableClock(NOW);
        DefaultBeatSyncService retaining = newService(Runnable::run, clock);

        String expired = retaining.submitSession(request(List.of(0.0, 1.0), "videos-long.mp4", "videos-short.mp4"), null);
        Files.createDirectories(properties.outputDir());
        Files.writeString(retaining.outputPath(expired), "mp4");
        clock.advance(Duration.ofMinutes(45));
        String recent = retaining.submitSession(request(List.of(0.0, 1.0), "videos-long.mp4", "videos-short.mp4"), null);

        clock.advance(Duration.ofMinutes(30));
        retaining.submitSession(request(List.of(0.0, 1.0), "videos-long.mp4", "videos-short.mp4"), null);

        assertThat(retaining.getSessionStatus(recent).orElseThrow().state()).isEqualTo(SessionState.COMPLETED);
        assertThat(retaining.getSessionStatus(expired)).isEmpty();
        assertThat(retaining.outputPath(expired)).doesNotExist();
        assertThat(retaining.getSessionStatus(recent)).isPresent();
    }

    @Test
    void queuedSessionsSurviveEviction() {
        List<Runnable> pending = new ArrayList<>();
        AdjustableClock clock = new AdjustableClock(NOW);
        DefaultBeatSyncService deferred = newService(pending::add, clock);

        String queued = deferred.submitSession(request(List.of(0.0, 1.0), "videos-long.mp4"), null);
        clock.advance(Duration.ofHours(3));
        deferred.evictExpiredSessions();

        assertThat(deferred.getSessionStatus(queued)).isPresent();
    }

    @Test
    void unknownSessionHasNoStatus() {
        assertThat(service.getSessionStatus("missing")).isEmpty();
        assertThat(service.outputPath("abc").getFileName().toString()).isEqualTo("final_abc.mp4");
    }

    private DefaultBeatSyncService newService(TaskExecutor executor) {
        return newService(executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private DefaultBeatSyncService newService(TaskExecutor executor, Clock clock) {
        return new DefaultBeatSyncService(
                new UploadStorageService(properties.uploadsDir()),
                new SessionWorkspaceManager(properties.workspaceRoot(), Clock.fixed(NOW, ZoneOffset.UTC)),
                assetValidator,
                new ClipAssignmentEngine(new Random(3)),
                segmentRenderer,
                timelineAssembler,
                channelRegistry,
                executor,
                meterRegistry,
                clock,
                properties);
    }

    private void stubValidationKeepsEveryClip() throws Exception {
        when(assetValidator.validate(anyList(), any(TargetFormat.class), any(SessionWorkspace.class), any()))
                .thenAnswer(invocation -> {
                    List<MediaAsset> assets = invocation.getArgument(0);
                    List<MediaAsset> validated = new ArrayList<>();
                    for (MediaAsset asset : assets) {
                        validated.add(asset.validated(CLIP_DURATIONS.get(asset.id())));
                    }
                    return validated;
                });
    }

    private void stubRenderingMatchesRequestedDuration() throws Exception {
        when(segmentRenderer.render(any(MediaAsset.class), anyDouble(), any(TargetFormat.class), any(SessionWorkspace.class), anyInt()))
                .thenAnswer(invocation -> {
                    MediaAsset asset = invocation.getArgument(0);
                    double target = invocation.getArgument(1);
                    SessionWorkspace workspace = invocation.getArgument(3);
                    int index = invocation.getArgument(4);
                    boolean extended = asset.durationSeconds() < target;
                    return new RenderedSegment(
                            workspace.resolve("trimmed_" + index + ".mp4"),
                            target,
                            extended ? asset.durationSeconds() * 2.0 : asset.durationSeconds(),
                            extended);
                });
        stubAssembly();
    }

    private void stubAssembly() throws Exception {
        when(timelineAssembler.concatenate(anyList(), any(SessionWorkspace.class)))
                .thenAnswer(invocation -> ((SessionWorkspace) invocation.getArgument(1)).resolve("merged.mp4"));
    }

    private static ProcessSessionRequest request(List<Double> beats, String... videoFiles) {
        List<VideoFileReference> references = new ArrayList<>();
        for (String videoFile : videoFiles) {
            references.add(new VideoFileReference(videoFile, videoFile));
        }
        return new ProcessSessionRequest("audio-song.mp3", references, beats, false, null);
    }

    private static final class AdjustableClock extends Clock {

        private Instant now;

        AdjustableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
