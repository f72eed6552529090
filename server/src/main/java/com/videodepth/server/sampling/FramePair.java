package com.videodepth.server.sampling;

/**
 * Ordered pair of frames. {@code (a, b)} and {@code (b, a)} are different
 * values until canonicalized with {@link FramePairs#toOneWay}.
 */
public final class FramePair {

    private final int first;
    private final int second;

    public FramePair(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public static FramePair of(int first, int second) {
        return new FramePair(first, second);
    }

    public int getFirst() {
        return first;
    }

    public int getSecond() {
        return second;
    }

    public FramePair reversed() {
        return new FramePair(second, first);
    }

    public boolean isSelfPair() {
        return first == second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FramePair)) {
            return false;
        }
        FramePair other = (FramePair) o;
        return first == other.first && second == other.second;
    }

    @Override
    public int hashCode() {
        return 31 * first + second;
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
