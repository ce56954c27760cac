package github.sarthakdev143.beat_cutter.service;

import github.sarthakdev143.beat_cutter.workspace.SessionWorkspace;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface TimelineAssembler {

    Path concatenate(List<Path> orderedSegments, SessionWorkspace workspace) throws IOException, InterruptedException;

    void muxAudio(Path mergedVideoPath, Path audioPath, Path finalPath) throws IOException, InterruptedException;
}
