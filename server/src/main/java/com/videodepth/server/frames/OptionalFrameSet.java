package com.videodepth.server.frames;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A set of frame numbers, or no restriction at all. An unbounded set contains
 * every frame and is the identity for {@link #intersection}.
 * <p>
 * Frames are held as sorted, disjoint, inclusive intervals, so a range such as
 * {@code 0-2000000000} costs one entry.
 */
public final class OptionalFrameSet {

    private static final OptionalFrameSet UNBOUNDED = new OptionalFrameSet("all", null);

    /**
     * Inclusive interval of frame numbers.
     */
    public static final class Interval {
        private final int from;
        private final int to;

        public Interval(int from, int to) {
            if (to < from) {
                throw new IllegalArgumentException("Descending interval " + from + "-" + to);
            }
            this.from = from;
            this.to = to;
        }

        public int getFrom() {
            return from;
        }

        public int getTo() {
            return to;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Interval)) {
                return false;
            }
            Interval other = (Interval) o;
            return from == other.from && to == other.to;
        }

        @Override
        public int hashCode() {
            return 31 * from + to;
        }

        @Override
        public String toString() {
            return from == to ? Integer.toString(from) : from + "-" + to;
        }
    }

    private final String name;
    // null when unbounded
    private final List<Interval> intervals;

    private OptionalFrameSet(String name, List<Interval> intervals) {
        this.name = name;
        this.intervals = intervals;
    }

    public static OptionalFrameSet unbounded() {
        return UNBOUNDED;
    }

    public static OptionalFrameSet of(Collection<Integer> frames) {
        return named(null, frames);
    }

    public static OptionalFrameSet named(String name, Collection<Integer> frames) {
        if (frames == null) {
            return UNBOUNDED;
        }
        List<Interval> intervals = new ArrayList<>();
        for (int frame : new TreeSet<>(frames)) {
            intervals.add(new Interval(frame, frame));
        }
        return new OptionalFrameSet(name, merge(intervals));
    }

    public static OptionalFrameSet ofIntervals(String name, List<Interval> intervals) {
        if (intervals == null) {
            return UNBOUNDED;
        }
        return new OptionalFrameSet(name, merge(new ArrayList<>(intervals)));
    }

    private static List<Interval> merge(List<Interval> intervals) {
        intervals.sort((a, b) -> Integer.compare(a.from, b.from));
        List<Interval> merged = new ArrayList<>();
        for (Interval next : intervals) {
            if (!merged.isEmpty()) {
                Interval last = merged.get(merged.size() - 1);
                // overlapping or adjacent; long avoids overflow at Integer.MAX_VALUE
                if ((long) last.to + 1 >= next.from) {
                    merged.set(merged.size() - 1, new Interval(last.from, Math.max(last.to, next.to)));
                    continue;
                }
            }
            merged.add(next);
        }
        return Collections.unmodifiableList(merged);
    }

    public boolean isUnbounded() {
        return intervals == null;
    }

    public boolean contains(int frame) {
        if (intervals == null) {
            return true;
        }
        int lo = 0;
        int hi = intervals.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            Interval interval = intervals.get(mid);
            if (frame < interval.from) {
                hi = mid - 1;
            } else if (frame > interval.to) {
                lo = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the intervals in ascending order, or null when unbounded
     */
    public List<Interval> getIntervals() {
        return intervals;
    }

    /**
     * Frames of this set below {@code limit}, in ascending order. An unbounded
     * set yields {@code 0..limit-1}.
     */
    public Set<Integer> framesBelow(int limit) {
        Set<Integer> frames = new TreeSet<>();
        if (intervals == null) {
            for (int f = 0; f < limit; f++) {
                frames.add(f);
            }
            return frames;
        }
        for (Interval interval : intervals) {
            if (interval.from >= limit) {
                break;
            }
            int end = Math.min(interval.to, limit - 1);
            for (int f = interval.from; f <= end; f++) {
                frames.add(f);
            }
        }
        return frames;
    }

    public String getName() {
        return name;
    }

    public OptionalFrameSet intersection(OptionalFrameSet other) {
        if (other == null || other.isUnbounded()) {
            return this;
        }
        if (isUnbounded()) {
            return other;
        }
        List<Interval> common = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < intervals.size() && j < other.intervals.size()) {
            Interval a = intervals.get(i);
            Interval b = other.intervals.get(j);
            int from = Math.max(a.from, b.from);
            int to = Math.min(a.to, b.to);
            if (from <= to) {
                common.add(new Interval(from, to));
            }
            if (a.to < b.to) {
                i++;
            } else {
                j++;
            }
        }
        return new OptionalFrameSet(name, Collections.unmodifiableList(common));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OptionalFrameSet)) {
            return false;
        }
        OptionalFrameSet other = (OptionalFrameSet) o;
        return intervals == null ? other.intervals == null : intervals.equals(other.intervals);
    }

    @Override
    public int hashCode() {
        return intervals == null ? 0 : intervals.hashCode();
    }

    @Override
    public String toString() {
        return isUnbounded() ? "OptionalFrameSet{all}" : "OptionalFrameSet{" + intervals + "}";
    }
}
