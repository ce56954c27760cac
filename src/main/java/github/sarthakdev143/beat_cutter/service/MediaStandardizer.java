package github.sarthakdev143.beat_cutter.service;

import github.sarthakdev143.beat_cutter.model.TargetFormat;

import java.io.IOException;
import java.nio.file.Path;

public interface MediaStandardizer {

    void standardize(Path sourcePath, TargetFormat targetFormat, Path outputPath) throws IOException, InterruptedException;
}
