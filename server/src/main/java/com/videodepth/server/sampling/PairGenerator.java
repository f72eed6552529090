package com.videodepth.server.sampling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Pair generators, one per {@link SamplingMode}. Each maps a frame count to a
 * set of pairs of relative indices in {@code [0, numFrames)}. All of them are
 * pure and share no state.
 */
public final class PairGenerator {

    private static final Logger logger = LoggerFactory.getLogger(PairGenerator.class);

    private static final Set<String> NO_KEYS = Collections.emptySet();
    private static final Set<String> HIERARCHICAL_KEYS = Set.of(
            SamplingParams.MIN_DIST, SamplingParams.MAX_DIST, SamplingParams.INCLUDE_MID_POINT);
    private static final Set<String> HIERARCHICAL2_KEYS = Set.of(
            SamplingParams.MIN_DIST, SamplingParams.MAX_DIST);

    private PairGenerator() {
    }

    public static Set<FramePair> generate(int numFrames, SamplingRequest request, boolean twoWay) {
        SamplingMode mode = request.getMode();
        if (mode == null) {
            throw new IllegalArgumentException("Sampling request has no mode, expected one of " + SamplingMode.names());
        }
        SamplingParams params = request.getParams();
        switch (mode) {
            case EXHAUSTED:
                checkKeys(mode, params, NO_KEYS);
                return exhausted(numFrames, twoWay);
            case CONSECUTIVE:
                checkKeys(mode, params, NO_KEYS);
                return consecutive(numFrames, twoWay);
            case HIERARCHICAL:
                checkKeys(mode, params, HIERARCHICAL_KEYS);
                return hierarchical(numFrames, twoWay, params.getMinDist(), params.getMaxDist(),
                        Boolean.TRUE.equals(params.getIncludeMidPoint()));
            case HIERARCHICAL2:
                checkKeys(mode, params, HIERARCHICAL2_KEYS);
                return hierarchical2(numFrames, twoWay, params.getMinDist(), params.getMaxDist());
            default:
                throw new IllegalStateException("Unhandled sampling mode " + mode);
        }
    }

    /**
     * Every pair of distinct frames. Quadratic, meant for short clips only.
     */
    public static Set<FramePair> exhausted(int numFrames, boolean twoWay) {
        checkFrameCount(numFrames);
        Set<FramePair> pairs = new HashSet<>();
        for (int i = 0; i < numFrames; i++) {
            for (int j = twoWay ? 0 : i + 1; j < numFrames; j++) {
                if (i != j) {
                    pairs.add(new FramePair(i, j));
                }
            }
        }
        return pairs;
    }

    public static Set<FramePair> consecutive(int numFrames, boolean twoWay) {
        return hierarchical(numFrames, twoWay, 1, 1, false);
    }

    public static Set<FramePair> hierarchical2(int numFrames, boolean twoWay, Integer minDist, Integer maxDist) {
        return hierarchical(numFrames, twoWay, minDist, maxDist, true);
    }

    /**
     * Pairs at dyadic distances {@code 2^level} for every level between
     * {@code ceil(log2(minDist))} and {@code floor(log2(maxDist))}.
     * Start frames are spaced {@code 2^level} apart, or {@code 2^(level-1)}
     * when {@code includeMidPoint} is set.
     *
     * @param minDist smallest pairing distance, defaults to 1, must be at least 1
     * @param maxDist largest pairing distance, defaults to {@code numFrames - 1}
     */
    public static Set<FramePair> hierarchical(int numFrames, boolean twoWay, Integer minDist, Integer maxDist,
            boolean includeMidPoint) {
        checkFrameCount(numFrames);
        int min = minDist != null ? minDist : 1;
        if (min < 1) {
            throw new IllegalArgumentException("min_dist must be >= 1, got " + min);
        }
        int max = maxDist != null ? maxDist : numFrames - 1;

        Set<FramePair> pairs = new HashSet<>();
        if (max < 1) {
            // log2 of a non-positive distance has no level
            return pairs;
        }

        int minLevel = ceilLog2(min);
        int maxLevel = floorLog2(max);
        int[] signs = twoWay ? new int[] { -1, 1 } : new int[] { 1 };
        logger.debug("Hierarchical sampling of {} frames over levels [{}, {}], midPoint={}", numFrames, minLevel,
                maxLevel, includeMidPoint);

        for (int level = minLevel; level <= maxLevel; level++) {
            long dist = 1L << level;
            int stepLevel = includeMidPoint ? Math.max(0, level - 1) : level;
            long step = 1L << stepLevel;
            for (long start = 0; start < numFrames; start += step) {
                for (int sign : signs) {
                    long end = start + sign * dist;
                    if (end < 0 || end >= numFrames) {
                        continue;
                    }
                    pairs.add(new FramePair((int) start, (int) end));
                }
            }
        }
        return pairs;
    }

    static int ceilLog2(int value) {
        return value <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(value - 1);
    }

    static int floorLog2(int value) {
        return 31 - Integer.numberOfLeadingZeros(value);
    }

    private static void checkFrameCount(int numFrames) {
        if (numFrames < 0) {
            throw new IllegalArgumentException("numFrames must be >= 0, got " + numFrames);
        }
    }

    private static void checkKeys(SamplingMode mode, SamplingParams params, Set<String> accepted) {
        for (String key : params.keys()) {
            if (!accepted.contains(key)) {
                throw new IllegalArgumentException("Unknown parameter '" + key + "' for sampling mode "
                        + mode.modeName() + ", accepted: " + accepted);
            }
        }
    }
}
