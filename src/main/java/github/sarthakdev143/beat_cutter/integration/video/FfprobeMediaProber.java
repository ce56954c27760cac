package github.sarthakdev143.beat_cutter.integration.video;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.beat_cutter.exception.MediaProbeException;
import github.sarthakdev143.beat_cutter.model.FrameRate;
import github.sarthakdev143.beat_cutter.model.MediaMetadata;
import github.sarthakdev143.beat_cutter.service.MediaProber;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
public class FfprobeMediaProber implements MediaProber {

    private final FfmpegCommandRunner commandRunner;
    private final ObjectMapper objectMapper;

    public FfprobeMediaProber(FfmpegCommandRunner commandRunner, ObjectMapper objectMapper) {
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
    }

    @Override
    public MediaMetadata probe(Path mediaPath) throws MediaProbeException, InterruptedException {
        if (!Files.isReadable(mediaPath)) {
            throw new MediaProbeException("File is not readable: " + mediaPath.getFileName());
        }

        String output;
        try {
            output = commandRunner.capture(buildProbeCommand(mediaPath), "probe " + mediaPath.getFileName());
        } catch (IOException e) {
            throw new MediaProbeException("Probe failed for " + mediaPath.getFileName() + ": " + e.getMessage(), e);
        }
        return parseProbeOutput(output);
    }

    List<String> buildProbeCommand(Path mediaPath) {
        return List.of(
                commandRunner.ffprobeBinary(),
                "-v",
                "error",
                "-print_format",
                "json",
                "-show_format",
                "-show_streams",
                mediaPath.toString());
    }

    MediaMetadata parseProbeOutput(String json) throws MediaProbeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MediaProbeException("Probe output is not valid JSON.", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new MediaProbeException("Probe returned no output.");
        }

        JsonNode videoStream = findStream(root, "video");
        if (videoStream == null) {
            throw new MediaProbeException("No video stream found");
        }
        JsonNode audioStream = findStream(root, "audio");

        FrameRate frameRate;
        try {
            frameRate = FrameRate.parse(videoStream.path("r_frame_rate").asText(null));
        } catch (IllegalArgumentException e) {
            throw new MediaProbeException("Unreadable video frame rate: " + e.getMessage(), e);
        }

        return new MediaMetadata(
                resolveDuration(root, videoStream),
                videoStream.path("width").asInt(0),
                videoStream.path("height").asInt(0),
                frameRate,
                videoStream.path("codec_name").asText(null),
                audioStream == null ? null : audioStream.path("codec_name").asText(null));
    }

    private JsonNode findStream(JsonNode root, String codecType) {
        for (JsonNode stream : root.path("streams")) {
            if (codecType.equals(stream.path("codec_type").asText())) {
                return stream;
            }
        }
        return null;
    }

    private double resolveDuration(JsonNode root, JsonNode videoStream) throws MediaProbeException {
        double duration = root.path("format").path("duration").asDouble(Double.NaN);
        if (!Double.isFinite(duration) || duration <= 0.0) {
            duration = videoStream.path("duration").asDouble(Double.NaN);
        }
        if (!Double.isFinite(duration) || duration <= 0.0) {
            throw new MediaProbeException("Media duration is unknown.");
        }
        return duration;
    }
}
