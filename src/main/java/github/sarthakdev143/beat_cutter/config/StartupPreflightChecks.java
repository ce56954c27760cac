package github.sarthakdev143.beat_cutter.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "beat-cutter.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int BINARY_CHECK_TIMEOUT_SECONDS = 10;

    private final BeatCutterProperties properties;

    public StartupPreflightChecks(BeatCutterProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBinary(properties.ffmpegPath(), "FFMPEG_PATH");
        checkBinary(properties.ffprobePath(), "FFPROBE_PATH");
        ensureDirectory(properties.uploadsDir());
        ensureDirectory(properties.workspaceRoot());
        ensureDirectory(properties.outputDir());
    }

    private void checkBinary(String binary, String overrideEnv) {
        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            boolean finished = process.waitFor(BINARY_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                if (!finished) {
                    process.destroyForcibly();
                }
                throw new IllegalStateException(
                        binary + " is not usable. Install FFmpeg or set " + overrideEnv + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    binary + " is not available. Install FFmpeg or set " + overrideEnv + ".",
                    e);
        }
    }

    private void ensureDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
            logger.info("Using storage directory {}", directory.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create storage directory " + directory.toAbsolutePath(), e);
        }
    }
}
