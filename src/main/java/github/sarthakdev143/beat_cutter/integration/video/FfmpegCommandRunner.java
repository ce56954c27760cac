package github.sarthakdev143.beat_cutter.integration.video;

import github.sarthakdev143.beat_cutter.config.BeatCutterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs FFmpeg/FFprobe processes and waits at most the configured timeout for them to exit. Output is
 * drained on a helper thread so a silent or hung process cannot outlive the timeout. A non-zero exit
 * code or a timeout is reported as an {@link IOException} carrying the captured output.
 */
@Component
public class FfmpegCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCommandRunner.class);
    private static final int MAX_REPORTED_OUTPUT_CHARS = 4000;
    private static final Duration OUTPUT_DRAIN_GRACE = Duration.ofSeconds(5);

    private final String ffmpegBinary;
    private final String ffprobeBinary;
    private final Duration timeout;

    public FfmpegCommandRunner(BeatCutterProperties properties) {
        this(properties.ffmpegPath(), properties.ffprobePath(), properties.commandTimeout());
    }

    FfmpegCommandRunner(String ffmpegBinary, String ffprobeBinary, Duration timeout) {
        this.ffmpegBinary = ffmpegBinary;
        this.ffprobeBinary = ffprobeBinary;
        this.timeout = timeout;
    }

    public String ffmpegBinary() {
        return ffmpegBinary;
    }

    public String ffprobeBinary() {
        return ffprobeBinary;
    }

    /**
     * Runs a command with stderr merged into stdout and discards the output on success.
     */
    public void run(List<String> command, String stage) throws IOException, InterruptedException {
        execute(command, stage, true);
    }

    /**
     * Runs a command and returns its stdout. Stderr is discarded so that machine-readable output
     * (ffprobe JSON) is not interleaved with diagnostics.
     */
    public String capture(List<String> command, String stage) throws IOException, InterruptedException {
        return execute(command, stage, false);
    }

    private String execute(List<String> command, String stage, boolean mergeErrorStream)
            throws IOException, InterruptedException {
        logger.info("Running command for stage {}: {}", stage, String.join(" ", command));
        ProcessBuilder builder = new ProcessBuilder(command);
        if (mergeErrorStream) {
            builder.redirectErrorStream(true);
        } else {
            builder.redirectError(ProcessBuilder.Redirect.DISCARD);
        }
        Process process = builder.start();

        StringBuffer output = new StringBuffer();
        Thread drainer = new Thread(() -> drain(process, output), "ffmpeg-output-" + stage);
        drainer.setDaemon(true);
        drainer.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("Command timed out after " + timeout.toMillis() + " ms during stage: " + stage);
        }
        drainer.join(OUTPUT_DRAIN_GRACE.toMillis());

        if (process.exitValue() != 0) {
            throw new IOException(
                    "Command failed during stage "
                            + stage
                            + " with exit code "
                            + process.exitValue()
                            + ". Output: "
                            + tail(output));
        }
        return output.toString();
    }

    private static void drain(Process process, StringBuffer output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        } catch (IOException e) {
            // stream closes under us when the process is killed
            logger.debug("Stopped reading process output: {}", e.getMessage());
        }
    }

    private String tail(CharSequence output) {
        if (output.length() <= MAX_REPORTED_OUTPUT_CHARS) {
            return output.toString();
        }
        return "..." + output.subSequence(output.length() - MAX_REPORTED_OUTPUT_CHARS, output.length());
    }
}
