package github.sarthakdev143.beat_cutter.integration.video;

import github.sarthakdev143.beat_cutter.model.MediaAsset;
import github.sarthakdev143.beat_cutter.model.RenderedSegment;
import github.sarthakdev143.beat_cutter.model.TargetFormat;
import github.sarthakdev143.beat_cutter.service.SegmentRenderer;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders one interval's segment at the session's target format.
 *
 * <p>When the assigned clip is at least as long as the interval, the clip is trimmed from its
 * start. When it is shorter, the clip is rendered forward, reversed, and the two copies are joined
 * (a "boomerang") before trimming. The extension is applied once: a clip shorter than half the
 * interval produces an under-run segment that the caller is told about through
 * {@link RenderedSegment#isUnderrun()}.
 */
@Component
public class FfmpegSegmentRenderer implements SegmentRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegSegmentRenderer.class);

    private final FfmpegCommandRunner commandRunner;

    public FfmpegSegmentRenderer(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public RenderedSegment render(
            MediaAsset asset,
            double targetDurationSeconds,
            TargetFormat targetFormat,
            SessionWorkspace workspace,
            int intervalIndex) throws IOException, InterruptedException {
        if (!asset.valid()) {
            throw new IllegalArgumentException("Cannot render invalid asset " + asset.id());
        }
        if (targetDurationSeconds <= 0.0) {
            throw new IllegalArgumentException("Target duration must be positive for interval " + intervalIndex);
        }

        Path outputPath = workspace.resolve("trimmed_" + intervalIndex + ".mp4");
        try {
            if (asset.durationSeconds() >= targetDurationSeconds) {
                commandRunner.run(
                        buildTrimCommand(asset.storagePath(), targetDurationSeconds, targetFormat, outputPath),
                        "trim interval " + intervalIndex);
                return new RenderedSegment(outputPath, targetDurationSeconds, asset.durationSeconds(), false);
            }
            return renderExtended(asset, targetDurationSeconds, targetFormat, workspace, intervalIndex, outputPath);
        } catch (IOException | InterruptedException | RuntimeException e) {
            workspace.discard(outputPath);
            throw e;
        }
    }

    private RenderedSegment renderExtended(
            MediaAsset asset,
            double targetDurationSeconds,
            TargetFormat targetFormat,
            SessionWorkspace workspace,
            int intervalIndex,
            Path outputPath) throws IOException, InterruptedException {
        Path forwardPath = workspace.resolve("forward_" + intervalIndex + ".mp4");
        Path reversePath = workspace.resolve("reverse_" + intervalIndex + ".mp4");
        Path joinedPath = workspace.resolve("concat_" + intervalIndex + ".mp4");
        Path joinListPath = workspace.resolve("concat_list_" + intervalIndex + ".txt");

        double availableDuration = asset.durationSeconds() * 2.0;
        if (availableDuration < targetDurationSeconds) {
            logger.warn(
                    "Clip {} ({}s) is too short for interval {} ({}s) even after reverse-loop extension; "
                            + "segment will under-run by {}s",
                    asset.originalName(),
                    FfmpegEncodeOptions.formatSeconds(asset.durationSeconds()),
                    intervalIndex,
                    FfmpegEncodeOptions.formatSeconds(targetDurationSeconds),
                    FfmpegEncodeOptions.formatSeconds(targetDurationSeconds - availableDuration));
        }

        try {
            commandRunner.run(
                    buildForwardCommand(asset.storagePath(), targetFormat, forwardPath),
                    "forward render interval " + intervalIndex);
            commandRunner.run(
                    buildReverseCommand(forwardPath, targetFormat, reversePath),
                    "reverse render interval " + intervalIndex);

            Files.writeString(joinListPath, buildJoinList(forwardPath, reversePath), StandardCharsets.UTF_8);
            commandRunner.run(
                    buildJoinCommand(joinListPath, targetFormat, joinedPath),
                    "join forward and reverse interval " + intervalIndex);
            commandRunner.run(
                    buildTrimCommand(joinedPath, targetDurationSeconds, targetFormat, outputPath),
                    "final trim interval " + intervalIndex);
        } finally {
            workspace.discard(forwardPath);
            workspace.discard(reversePath);
            workspace.discard(joinedPath);
            workspace.discard(joinListPath);
        }

        return new RenderedSegment(outputPath, targetDurationSeconds, availableDuration, true);
    }

    List<String> buildTrimCommand(Path inputPath, double durationSeconds, TargetFormat targetFormat, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-ss");
        command.add(FfmpegEncodeOptions.formatSeconds(0.0));
        command.add("-i");
        command.add(inputPath.toString());
        command.add("-t");
        command.add(FfmpegEncodeOptions.formatSeconds(durationSeconds));
        FfmpegEncodeOptions.appendConformantVideo(command, targetFormat);
        FfmpegEncodeOptions.appendConformantAudio(command);
        FfmpegEncodeOptions.appendTimestampNormalization(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildForwardCommand(Path inputPath, TargetFormat targetFormat, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(inputPath.toString());
        FfmpegEncodeOptions.appendConformantVideo(command, targetFormat);
        FfmpegEncodeOptions.appendConformantAudio(command);
        FfmpegEncodeOptions.appendTimestampNormalization(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildReverseCommand(Path forwardPath, TargetFormat targetFormat, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(forwardPath.toString());
        command.add("-vf");
        command.add("reverse");
        command.add("-af");
        command.add("areverse");
        FfmpegEncodeOptions.appendConformantVideo(command, targetFormat);
        FfmpegEncodeOptions.appendConformantAudio(command);
        FfmpegEncodeOptions.appendTimestampNormalization(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildJoinCommand(Path listPath, TargetFormat targetFormat, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-f");
        command.add("concat");
        command.add("-safe");
        command.add("0");
        command.add("-i");
        command.add(listPath.toString());
        FfmpegEncodeOptions.appendConformantVideo(command, targetFormat);
        FfmpegEncodeOptions.appendConformantAudio(command);
        FfmpegEncodeOptions.appendTimestampNormalization(command);
        command.add(outputPath.toString());
        return command;
    }

    String buildJoinList(Path forwardPath, Path reversePath) {
        return FfmpegEncodeOptions.concatListLine(forwardPath)
                + "\n"
                + FfmpegEncodeOptions.concatListLine(reversePath)
                + "\n";
    }
}
