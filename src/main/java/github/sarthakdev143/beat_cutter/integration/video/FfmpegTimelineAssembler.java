package github.sarthakdev143.beat_cutter.integration.video;

import github.sarthakdev143.beat_cutter.service.TimelineAssembler;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspace;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class FfmpegTimelineAssembler implements TimelineAssembler {

    static final String SEGMENT_LIST_FILE = "filelist.txt";
    static final String MERGED_FILE = "merged.mp4";

    private final FfmpegCommandRunner commandRunner;

    public FfmpegTimelineAssembler(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    /**
     * Joins the segments in the given order without re-encoding. Every segment must share codec,
     * resolution, frame rate and sample rate.
     */
    @Override
    public Path concatenate(List<Path> orderedSegments, SessionWorkspace workspace)
            throws IOException, InterruptedException {
        if (orderedSegments == null || orderedSegments.isEmpty()) {
            throw new IllegalArgumentException("At least one segment is required for concatenation.");
        }

        Path listPath = workspace.resolve(SEGMENT_LIST_FILE);
        Path mergedPath = workspace.resolve(MERGED_FILE);
        Files.writeString(listPath, buildSegmentList(orderedSegments), StandardCharsets.UTF_8);
        commandRunner.run(buildConcatCommand(listPath, mergedPath), "merge " + orderedSegments.size() + " segments");
        return mergedPath;
    }

    @Override
    public void muxAudio(Path mergedVideoPath, Path audioPath, Path finalPath) throws IOException, InterruptedException {
        Path parent = finalPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            commandRunner.run(buildAudioMuxCommand(mergedVideoPath, audioPath, finalPath), "mux audio track");
        } catch (IOException | InterruptedException e) {
            Files.deleteIfExists(finalPath);
            throw e;
        }
    }

    String buildSegmentList(List<Path> orderedSegments) {
        StringBuilder list = new StringBuilder();
        for (Path segment : orderedSegments) {
            list.append(FfmpegEncodeOptions.concatListLine(segment)).append('\n');
        }
        return list.toString();
    }

    List<String> buildConcatCommand(Path listPath, Path mergedPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.ffmpegBinary());
        command.add("-y");
        command.add("-f");
        command.add("concat");
        command.add("-safe");
        command.add("0");
        command.add("-i");
        command.add(listPath.toString());
        command.add("-c");
        command.add("copy");
        command.add("-fflags");
        command.add("+genpts");
        command.add(mergedPath.toString());
        return command;
    }

    List<String> buildAudioMuxCommand(Path mergedVideoPath, Path audioPath, Path finalPath) {
        return List.of(
                commandRunner.ffmpegBinary(),
                "-y",
                "-i",
                mergedVideoPath.toString(),
                "-i",
                audioPath.toString(),
                "-map",
                "0:v:0",
                "-map",
                "1:a:0",
                "-c:v",
                "copy",
                "-c:a",
                "aac",
                "-b:a",
                FfmpegEncodeOptions.DELIVERY_AUDIO_BITRATE,
                "-shortest",
                finalPath.toString());
    }
}
