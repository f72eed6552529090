package com.videodepth.server.service;

import com.videodepth.server.sampling.FramePair;

import java.util.List;

public class SamplingResult {

    private final List<FramePair> pairs;
    private final List<Integer> filteredOutFrames;
    private final String runKey;

    public SamplingResult(List<FramePair> pairs, List<Integer> filteredOutFrames, String runKey) {
        this.pairs = pairs;
        this.filteredOutFrames = filteredOutFrames;
        this.runKey = runKey;
    }

    // Sorted by first, then second frame
    public List<FramePair> getPairs() {
        return pairs;
    }

    public List<Integer> getFilteredOutFrames() {
        return filteredOutFrames;
    }

    public String getRunKey() {
        return runKey;
    }

    public int getCount() {
        return pairs.size();
    }
}
