package github.sarthakdev143.beat_cutter.integration.video;

import github.sarthakdev143.beat_cutter.model.TargetFormat;
import github.sarthakdev143.beat_cutter.service.MediaStandardizer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class FfmpegMediaStandardizer implements MediaStandardizer {

    private final FfmpegCommandRunner commandRunner;

    public FfmpegMediaStandardizer(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public void standardize(Path sourcePath, TargetFormat targetFormat, Path outputPath)
            throws IOException, InterruptedException {
        commandRunner.run(
                buildStandardizeCommand(sourcePath, targetFormat, outputPath),
                "standardize " + sourcePath.getFileName());
    }

    List<String> buildStandardizeCommand(Path sourcePath, TargetFormat targetFormat, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(sourcePath.toString());
        FfmpegEncodeOptions.appendConformantVideo(command, targetFormat);
        FfmpegEncodeOptions.appendConformantAudio(command);
        command.add(outputPath.toString());
        return command;
    }
}
