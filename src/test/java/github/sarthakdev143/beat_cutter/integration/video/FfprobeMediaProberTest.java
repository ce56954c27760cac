package github.sarthakdev143.beat_cutter.integration.video;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.beat_cutter.exception.MediaProbeException;
import github.sarthakdev143.beat_cutter.model.FrameRate;
import github.sarthakdev143.beat_cutter.model.MediaMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FfprobeMediaProberTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesConformantClip() throws Exception {
        FfprobeMediaProber prober = new FfprobeMediaProber(new RecordingCommandRunner(), new ObjectMapper());

        MediaMetadata metadata = prober.parseProbeOutput(fixture("conformant-clip.json"));

        assertThat(metadata.durationSeconds()).isCloseTo(5.013333, within(1e-6));
        assertThat(metadata.width()).isEqualTo(1920);
        assertThat(metadata.height()).isEqualTo(1088);
        assertThat(metadata.frameRate()).isEqualTo(FrameRate.of(24));
        assertThat(metadata.videoCodec()).isEqualTo("h264");
        assertThat(metadata.audioCodec()).isEqualTo("aac");
    }

    @Test
    void fallsBackToStreamDurationAndKeepsRationalFrameRate() throws Exception {
        FfprobeMediaProber prober = new FfprobeMediaProber(new RecordingCommandRunner(), new ObjectMapper());

        MediaMetadata metadata = prober.parseProbeOutput(fixture("ntsc-silent-clip.json"));

        assertThat(metadata.durationSeconds()).isCloseTo(2.002, within(1e-6));
        assertThat(metadata.frameRate()).isEqualTo(new FrameRate(30000, 1001));
        assertThat(metadata.hasAudio()).isFalse();
    }

    @Test
    void fileWithoutVideoStreamIsRejected() throws Exception {
        FfprobeMediaProber prober = new FfprobeMediaProber(new RecordingCommandRunner(), new ObjectMapper());
        String json = fixture("audio-only.json");

        assertThatThrownBy(() -> prober.parseProbeOutput(json))
                .isInstanceOf(MediaProbeException.class)
                .hasMessage("No video stream found");
    }

    @Test
    void malformedFrameRateIsAProbeError() {
        FfprobeMediaProber prober = new FfprobeMediaProber(new RecordingCommandRunner(), new ObjectMapper());
        String json = "{\"streams\":[{\"codec_type\":\"video\",\"codec_name\":\"h264\",\"r_frame_rate\":\"0/0\"}],"
                + "\"format\":{\"duration\":\"1.0\"}}";

        assertThatThrownBy(() -> prober.parseProbeOutput(json))
                .isInstanceOf(MediaProbeException.class)
                .hasMessageContaining("frame rate");
    }

    @Test
    void missingDurationIsAProbeError() {
        FfprobeMediaProber prober = new FfprobeMediaProber(new RecordingCommandRunner(), new ObjectMapper());
        String json = "{\"streams\":[{\"codec_type\":\"video\",\"codec_name\":\"h264\",\"r_frame_rate\":\"25/1\"}],"
                + "\"format\":{}}";

        assertThatThrownBy(() -> prober.parseProbeOutput(json))
                .isInstanceOf(MediaProbeException.class)
                .hasMessage("Media duration is unknown.");
    }

    @Test
    void probeRunsFfprobeWithJsonOutput() throws Exception {
        Path clip = Files.writeString(tempDir.resolve("clip.mp4"), "video");
        RecordingCommandRunner runner = new RecordingCommandRunner().captureReturns(fixture("conformant-clip.json"));
        FfprobeMediaProber prober = new FfprobeMediaProber(runner, new ObjectMapper());

        MediaMetadata metadata = prober.probe(clip);

        assertThat(runner.commands.get(0)).containsExactly(
                "ffprobe", "-v", "error", "-print_format", "json", "-show_format", "-show_streams", clip.toString());
        assertThat(metadata.videoCodec()).isEqualTo("h264");
    }

    @Test
    void probeFailureIsWrapped() throws IOException {
        Path clip = Files.writeString(tempDir.resolve("clip.mp4"), "video");
        RecordingCommandRunner runner = new RecordingCommandRunner().failOn("probe");
        FfprobeMediaProber prober = new FfprobeMediaProber(runner, new ObjectMapper());

        assertThatThrownBy(() -> prober.probe(clip))
                .isInstanceOf(MediaProbeException.class)
                .hasMessageContaining("Probe failed for clip.mp4")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void unreadableFileIsRejectedWithoutRunningFfprobe() {
        RecordingCommandRunner runner = new RecordingCommandRunner();
        FfprobeMediaProber prober = new FfprobeMediaProber(runner, new ObjectMapper());

        assertThatThrownBy(() -> prober.probe(tempDir.resolve("missing.mp4")))
                .isInstanceOf(MediaProbeException.class);
        assertThat(runner.commands).isEmpty();
    }

    private static String fixture(String name) throws IOException {
        try (InputStream input = FfprobeMediaProberTest.class.getResourceAsStream("/ffprobe/" + name)) {
            assertThat(input).as("fixture %s", name).isNotNull();
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
