package github.sarthakdev143.beat_cutter.service;

import github.sarthakdev143.beat_cutter.model.MediaAsset;
import github.sarthakdev143.beat_cutter.model.RenderedSegment;
import github.sarthakdev143.beat_cutter.model.TargetFormat;
import github.sarthakdev143.beat_cutter.workspace.SessionWorkspace;

import java.io.IOException;

public interface SegmentRenderer {

    RenderedSegment render(
            MediaAsset asset,
            double targetDurationSeconds,
            TargetFormat targetFormat,
            SessionWorkspace workspace,
            int intervalIndex) throws IOException, InterruptedException;
}
