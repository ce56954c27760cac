package github.sarthakdev143.beat_cutter.service;

import github.sarthakdev143.beat_cutter.dto.SplitClipsRequest;
import github.sarthakdev143.beat_cutter.dto.SplitClipsResponse;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Cuts uploaded videos into consecutive clips of a fixed length, independent of any beat track.
 */
public interface ClipSplitService {

    SplitClipsResponse split(SplitClipsRequest request, String clientId) throws IOException, InterruptedException;

    Optional<Path> clipPath(String splitId, String filename);
}
