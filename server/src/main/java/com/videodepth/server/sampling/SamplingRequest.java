package com.videodepth.server.sampling;

import java.util.Objects;

/**
 * A sampling mode plus its parameters. Nothing is validated here; the
 * generator rejects bad parameters when the request is run.
 */
public final class SamplingRequest {

    private final SamplingMode mode;
    private final SamplingParams params;

    public SamplingRequest(SamplingMode mode, SamplingParams params) {
        this.mode = mode;
        this.params = params != null ? params : SamplingParams.empty();
    }

    public static SamplingRequest of(SamplingMode mode) {
        return new SamplingRequest(mode, SamplingParams.empty());
    }

    public SamplingMode getMode() {
        return mode;
    }

    public SamplingParams getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SamplingRequest)) {
            return false;
        }
        SamplingRequest other = (SamplingRequest) o;
        return mode == other.mode && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, params);
    }

    @Override
    public String toString() {
        return "SamplingRequest{mode=" + mode + ", params=" + params + "}";
    }
}
