package github.sarthakdev143.beat_cutter.service;

import github.sarthakdev143.beat_cutter.exception.MediaProbeException;
import github.sarthakdev143.beat_cutter.model.MediaMetadata;

import java.nio.file.Path;

public interface MediaProber {

    MediaMetadata probe(Path mediaPath) throws MediaProbeException, InterruptedException;
}
