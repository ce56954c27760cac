package github.sarthakdev143.beat_cutter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "beat-cutter")
public record BeatCutterProperties(
        @DefaultValue("ffmpeg") String ffmpegPath,
        @DefaultValue("ffprobe") String ffprobePath,
        @DefaultValue("10m") Duration commandTimeout,
        @DefaultValue("data/uploads") Path uploadsDir,
        @DefaultValue("data/temp") Path workspaceRoot,
        @DefaultValue("data/output") Path outputDir,
        @DefaultValue("2.0") double tailIntervalSeconds,
        @DefaultValue("2") int maxConcurrentSessions,
        @DefaultValue("16") int sessionQueueCapacity,
        @DefaultValue("1h") Duration sessionRetention,
        @DefaultValue({"http://localhost:5173", "http://127.0.0.1:5173"}) List<String> allowedOrigins) {

    public BeatCutterProperties {
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    }
}
