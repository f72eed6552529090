package com.videodepth.server.sampling;

import com.videodepth.server.frames.FrameRange;
import com.videodepth.server.frames.OptionalFrameSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class PairSamplerTest {

    private static final List<SamplingRequest> CONSECUTIVE = List.of(SamplingRequest.of(SamplingMode.CONSECUTIVE));

    @Test
    public void testActiveSubsetFilter() {
        FrameRange range = new FrameRange(OptionalFrameSet.of(List.of(0, 2, 4)), 5);
        Set<FramePair> pairs = PairSampler.sample(CONSECUTIVE, range, true);

        assertTrue(pairs.contains(FramePair.of(1, 2)));
        assertFalse(pairs.contains(FramePair.of(1, 1)));
        for (FramePair p : pairs) {
            assertFalse(p.isSelfPair());
            assertTrue(range.contains(p.getFirst()) || range.contains(p.getSecond()), p.toString());
        }
        // every adjacent pair touches an even frame
        assertEquals(8, pairs.size());
    }

    @Test
    public void testSingleActiveFrame() {
        FrameRange range = new FrameRange(OptionalFrameSet.of(List.of(0)), 5);
        Set<FramePair> pairs = PairSampler.sample(CONSECUTIVE, range, true);
        assertEquals(Set.of(FramePair.of(0, 1), FramePair.of(1, 0)), pairs);
    }

    @Test
    public void testNoActiveFramesGivesEmptyResult() {
        FrameRange range = FrameRange.all(10).intersection(OptionalFrameSet.of(List.of()));
        assertTrue(PairSampler.sample(CONSECUTIVE, range, true).isEmpty());
    }

    @Test
    public void testUnionCollapsesDuplicates() {
        FrameRange range = FrameRange.all(12);
        List<SamplingRequest> requests = List.of(
                SamplingRequest.of(SamplingMode.CONSECUTIVE),
                new SamplingRequest(SamplingMode.HIERARCHICAL, SamplingParams.distances(1, 1)));
        assertEquals(PairSampler.sample(CONSECUTIVE, range, false), PairSampler.sample(requests, range, false));
    }

    @Test
    public void testUnionOfDifferentModes() {
        FrameRange range = FrameRange.all(9);
        List<SamplingRequest> requests = List.of(
                SamplingRequest.of(SamplingMode.CONSECUTIVE),
                new SamplingRequest(SamplingMode.HIERARCHICAL, SamplingParams.distances(8, 8)));
        Set<FramePair> pairs = PairSampler.sample(requests, range, false);
        assertEquals(9, pairs.size());
        assertTrue(pairs.contains(FramePair.of(0, 8)));
    }

    @Test
    public void testIndicesMappedToFrames() {
        FrameRange range = FrameRange.ofFrames(List.of(10, 20, 30, 40), OptionalFrameSet.unbounded());
        Set<FramePair> pairs = PairSampler.sample(CONSECUTIVE, range, false);
        assertEquals(Set.of(FramePair.of(10, 20), FramePair.of(20, 30), FramePair.of(30, 40)), pairs);
    }

    @Test
    public void testDeterministic() {
        FrameRange range = new FrameRange(OptionalFrameSet.of(List.of(1, 5, 6, 7, 20)), 30);
        List<SamplingRequest> requests = List.of(
                SamplingRequest.of(SamplingMode.HIERARCHICAL2),
                SamplingRequest.of(SamplingMode.CONSECUTIVE));
        assertEquals(PairSampler.sample(requests, range, true), PairSampler.sample(requests, range, true));
    }

    @Test
    public void testFailingRequestAbortsWholeSample() {
        List<SamplingRequest> requests = List.of(
                SamplingRequest.of(SamplingMode.CONSECUTIVE),
                new SamplingRequest(SamplingMode.HIERARCHICAL, SamplingParams.empty().withMinDist(0)));
        assertThrows(IllegalArgumentException.class, () -> PairSampler.sample(requests, FrameRange.all(8), true));
    }

    @Test
    public void testSamplePairsByName() {
        FrameRange range = FrameRange.all(17);
        assertEquals(PairSampler.sample(List.of(SamplingRequest.of(SamplingMode.HIERARCHICAL2)), range, true),
                PairSampler.samplePairs(range, List.of("hierarchical2")));
        assertThrows(IllegalArgumentException.class, () -> PairSampler.samplePairs(range, List.of("dense")));
    }

    @Test
    public void testParallelMatchesSequential() {
        FrameRange range = new FrameRange(OptionalFrameSet.of(List.of(0, 3, 9, 10, 11)), 24);
        List<SamplingRequest> requests = List.of(
                SamplingRequest.of(SamplingMode.CONSECUTIVE),
                SamplingRequest.of(SamplingMode.HIERARCHICAL),
                SamplingRequest.of(SamplingMode.HIERARCHICAL2),
                SamplingRequest.of(SamplingMode.EXHAUSTED));
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            assertEquals(PairSampler.sample(requests, range, true),
                    PairSampler.sampleParallel(requests, range, true, executor));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testParallelSurfacesGeneratorError() {
        List<SamplingRequest> requests = List.of(
                new SamplingRequest(SamplingMode.EXHAUSTED, SamplingParams.empty().withMaxDist(3)));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            assertThrows(IllegalArgumentException.class,
                    () -> PairSampler.sampleParallel(requests, FrameRange.all(8), true, executor));
        } finally {
            executor.shutdownNow();
        }
    }
}
