package com.videodepth.db;

public class SamplingRun {
    private final long id;
    private final String runKey;
    private final String flowOps;
    private final boolean twoWay;
    private final int pairCount;
    private final long createdTs;

    public SamplingRun(long id, String runKey, String flowOps, boolean twoWay, int pairCount, long createdTs) {
        this.id = id;
        this.runKey = runKey;
        this.flowOps = flowOps;
        this.twoWay = twoWay;
        this.pairCount = pairCount;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getRunKey() {
        return runKey;
    }

    public String getFlowOps() {
        return flowOps;
    }

    public boolean isTwoWay() {
        return twoWay;
    }

    public int getPairCount() {
        return pairCount;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "SamplingRun{id=" + id + ", key='" + runKey + "', pairs=" + pairCount + "}";
    }
}
