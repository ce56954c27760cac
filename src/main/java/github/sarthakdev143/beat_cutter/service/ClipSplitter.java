package github.sarthakdev143.beat_cutter.service;

import github.sarthakdev143.beat_cutter.model.TargetFormat;

import java.io.IOException;
import java.nio.file.Path;

public interface ClipSplitter {

    void cut(Path sourcePath, double startSeconds, double durationSeconds, TargetFormat targetFormat, Path outputPath)
            throws IOException, InterruptedException;
}
