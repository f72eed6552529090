package com.videodepth.server.sampling;

import com.videodepth.server.frames.FrameRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Combines the pairs of several sampling requests and maps them from indices
 * to frame numbers. Only pairs with at least one active frame are returned.
 */
public final class PairSampler {

    private static final Logger logger = LoggerFactory.getLogger(PairSampler.class);

    private PairSampler() {
    }

    public static Set<FramePair> sample(List<SamplingRequest> requests, FrameRange frameRange, boolean twoWay) {
        int numFrames = frameRange.length();

        Set<FramePair> relPairs = new HashSet<>();
        for (SamplingRequest request : requests) {
            relPairs.addAll(PairGenerator.generate(numFrames, request, twoWay));
        }
        return toFramePairs(relPairs, frameRange);
    }

    /**
     * Same result as {@link #sample}, with each request generated on the given
     * executor. The union is taken once every request has finished.
     */
    public static Set<FramePair> sampleParallel(List<SamplingRequest> requests, FrameRange frameRange,
            boolean twoWay, ExecutorService executor) {
        int numFrames = frameRange.length();

        List<Future<Set<FramePair>>> futures = new ArrayList<>();
        for (SamplingRequest request : requests) {
            futures.add(executor.submit(() -> PairGenerator.generate(numFrames, request, twoWay)));
        }

        Set<FramePair> relPairs = new HashSet<>();
        try {
            for (Future<Set<FramePair>> future : futures) {
                relPairs.addAll(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while sampling frame pairs", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Frame pair generation failed", e.getCause());
        }
        return toFramePairs(relPairs, frameRange);
    }

    /**
     * Samples the named flow ops with default parameters, in both directions.
     */
    public static Set<FramePair> samplePairs(FrameRange frameRange, List<String> flowOps) {
        List<SamplingRequest> requests = new ArrayList<>();
        for (String op : flowOps) {
            requests.add(SamplingRequest.of(SamplingMode.fromName(op)));
        }
        return sample(requests, frameRange, true);
    }

    private static Set<FramePair> toFramePairs(Set<FramePair> relPairs, FrameRange frameRange) {
        Set<FramePair> pairs = new HashSet<>();
        for (FramePair rel : relPairs) {
            FramePair pair = new FramePair(frameRange.indexToFrame(rel.getFirst()),
                    frameRange.indexToFrame(rel.getSecond()));
            if (frameRange.contains(pair.getFirst()) || frameRange.contains(pair.getSecond())) {
                pairs.add(pair);
            }
        }
        logger.info("Sampled {} frame pairs.", pairs.size());
        return pairs;
    }
}
