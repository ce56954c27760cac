package github.sarthakdev143.beat_cutter.service.impl;

import github.sarthakdev143.beat_cutter.exception.ClipAssignmentException;
import github.sarthakdev143.beat_cutter.model.ClipAssignment;
import github.sarthakdev143.beat_cutter.model.MediaAsset;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * Matches every beat interval with one clip from the pool, each clip used at most once.
 *
 * <p>Intervals are taken in input order. For each one the unused clip with the smallest
 * non-negative surplus ({@code clip - interval}) wins; the first candidate in scan order wins a
 * tie. When no unused clip is long enough, the first unused clip in scan order is taken and will be
 * extended at render time. This is a greedy policy and not an optimal packing.
 */
@Component
public class ClipAssignmentEngine {

    private final Random random;

    public ClipAssignmentEngine(Random random) {
        this.random = random;
    }

    public List<ClipAssignment> assign(List<Double> intervals, List<MediaAsset> pool, boolean randomize) {
        if (intervals == null || intervals.isEmpty()) {
            throw new IllegalArgumentException("At least one interval is required.");
        }
        List<MediaAsset> scanOrder = new ArrayList<>(pool == null ? List.of() : pool);
        for (MediaAsset asset : scanOrder) {
            if (!asset.valid()) {
                throw new IllegalArgumentException("Invalid asset " + asset.id() + " cannot be assigned.");
            }
        }
        if (randomize) {
            Collections.shuffle(scanOrder, random);
        }

        Set<String> usedAssetIds = new HashSet<>();
        List<ClipAssignment> assignments = new ArrayList<>(intervals.size());
        for (int index = 0; index < intervals.size(); index++) {
            double needed = intervals.get(index);
            MediaAsset chosen = findBestFit(scanOrder, usedAssetIds, needed);
            if (chosen == null) {
                chosen = findFirstUnused(scanOrder, usedAssetIds);
            }
            if (chosen == null) {
                throw new ClipAssignmentException(String.format(
                        Locale.ROOT,
                        "No suitable clip available for beat duration %.3fs (interval %d of %d, pool of %d clips).",
                        needed,
                        index + 1,
                        intervals.size(),
                        scanOrder.size()));
            }

            usedAssetIds.add(chosen.id());
            assignments.add(new ClipAssignment(index, chosen.id(), needed, chosen.durationSeconds()));
        }
        return List.copyOf(assignments);
    }

    private MediaAsset findBestFit(List<MediaAsset> scanOrder, Set<String> usedAssetIds, double needed) {
        MediaAsset best = null;
        double bestSurplus = Double.POSITIVE_INFINITY;
        for (MediaAsset candidate : scanOrder) {
            if (usedAssetIds.contains(candidate.id()) || candidate.durationSeconds() < needed) {
                continue;
            }
            double surplus = candidate.durationSeconds() - needed;
            if (surplus < bestSurplus) {
                bestSurplus = surplus;
                best = candidate;
            }
        }
        return best;
    }

    private MediaAsset findFirstUnused(List<MediaAsset> scanOrder, Set<String> usedAssetIds) {
        for (MediaAsset candidate : scanOrder) {
            if (!usedAssetIds.contains(candidate.id())) {
                return candidate;
            }
        }
        return null;
    }
}
