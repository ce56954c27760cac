package github.sarthakdev143.beat_cutter.integration.video;

import github.sarthakdev143.beat_cutter.model.TargetFormat;
import github.sarthakdev143.beat_cutter.service.ClipSplitter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class FfmpegClipSplitter implements ClipSplitter {

    private final FfmpegCommandRunner commandRunner;

    public FfmpegClipSplitter(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public void cut(Path sourcePath, double startSeconds, double durationSeconds, TargetFormat targetFormat, Path outputPath)
            throws IOException, InterruptedException {
        if (startSeconds < 0.0) {
            throw new IllegalArgumentException("Clip start must not be negative.");
        }
        if (!(durationSeconds > 0.0)) {
            throw new IllegalArgumentException("Clip duration must be positive.");
        }
        commandRunner.run(
                buildCutCommand(sourcePath, startSeconds, durationSeconds, targetFormat, outputPath),
                "split " + sourcePath.getFileName() + " at " + FfmpegEncodeOptions.formatSeconds(startSeconds));
    }

    List<String> buildCutCommand(
            Path sourcePath,
            double startSeconds,
            double durationSeconds,
            TargetFormat targetFormat,
            Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-ss");
        command.add(FfmpegEncodeOptions.formatSeconds(startSeconds));
        command.add("-i");
        command.add(sourcePath.toString());
        command.add("-t");
        command.add(FfmpegEncodeOptions.formatSeconds(durationSeconds));
        FfmpegEncodeOptions.appendConformantVideo(command, targetFormat);
        FfmpegEncodeOptions.appendConformantAudio(command);
        FfmpegEncodeOptions.appendTimestampNormalization(command);
        command.add(outputPath.toString());
        return command;
    }
}
