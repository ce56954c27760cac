package github.sarthakdev143.beat_cutter.integration.video;

import github.sarthakdev143.beat_cutter.model.TargetFormat;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Encoder arguments shared by every stage that writes a conformant segment. All segments of a
 * session are encoded with identical settings so the final join can be a stream copy.
 */
final class FfmpegEncodeOptions {

    static final String AUDIO_SAMPLE_RATE = "48000";
    static final String AUDIO_CHANNELS = "2";
    static final String STANDARDIZED_AUDIO_BITRATE = "140k";
    static final String DELIVERY_AUDIO_BITRATE = "192k";

    private FfmpegEncodeOptions() {
    }

    static void appendConformantVideo(List<String> command, TargetFormat targetFormat) {
        command.add("-c:v");
        command.add("libx264");
        command.add("-crf");
        command.add("0");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-r");
        command.add(targetFormat.frameRate().toFfmpegValue());
        command.add("-s");
        command.add(targetFormat.sizeExpression());
    }

    static void appendConformantAudio(List<String> command) {
        command.add("-c:a");
        command.add("aac");
        command.add("-ar");
        command.add(AUDIO_SAMPLE_RATE);
        command.add("-ac");
        command.add(AUDIO_CHANNELS);
        command.add("-b:a");
        command.add(STANDARDIZED_AUDIO_BITRATE);
    }

    static void appendTimestampNormalization(List<String> command) {
        command.add("-avoid_negative_ts");
        command.add("make_zero");
        command.add("-fflags");
        command.add("+genpts");
    }

    static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    /**
     * One line of an FFmpeg concat demuxer list, quoting the path the way the demuxer expects.
     */
    static String concatListLine(Path path) {
        String escaped = path.toAbsolutePath().toString().replace("'", "'\\''");
        return "file '" + escaped + "'";
    }
}
