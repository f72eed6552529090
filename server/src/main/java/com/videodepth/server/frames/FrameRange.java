package com.videodepth.server.frames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Index space used for pair sampling together with the set of frames that
 * results are restricted to.
 * <p>
 * Index {@code i} in {@code [0, length())} maps to a frame number through
 * {@link #indexToFrame}. The active frames are the subset of those frame
 * numbers a sampled pair must touch to be kept. Narrowing the active set with
 * {@link #intersection} leaves the index space unchanged.
 */
public final class FrameRange {

    private final List<Integer> indexToFrame;
    private final Set<Integer> activeFrames;

    private FrameRange(List<Integer> indexToFrame, Set<Integer> activeFrames) {
        this.indexToFrame = indexToFrame;
        this.activeFrames = activeFrames;
    }

    /**
     * Frames {@code 0..numFrames-1}, active where {@code range} allows.
     */
    public FrameRange(OptionalFrameSet range, int numFrames) {
        this(identity(numFrames), active(identity(numFrames), range));
    }

    public static FrameRange all(int numFrames) {
        return new FrameRange(OptionalFrameSet.unbounded(), numFrames);
    }

    /**
     * Non-contiguous index space: index {@code i} maps to {@code frames.get(i)}.
     */
    public static FrameRange ofFrames(List<Integer> frames, OptionalFrameSet range) {
        if (new TreeSet<>(frames).size() != frames.size()) {
            throw new IllegalArgumentException("Frame list contains duplicates: " + frames);
        }
        List<Integer> copy = Collections.unmodifiableList(new ArrayList<>(frames));
        return new FrameRange(copy, active(copy, range));
    }

    private static List<Integer> identity(int numFrames) {
        if (numFrames < 0) {
            throw new IllegalArgumentException("numFrames must be >= 0, got " + numFrames);
        }
        List<Integer> frames = new ArrayList<>(numFrames);
        for (int i = 0; i < numFrames; i++) {
            frames.add(i);
        }
        return Collections.unmodifiableList(frames);
    }

    private static Set<Integer> active(List<Integer> frames, OptionalFrameSet range) {
        OptionalFrameSet r = range != null ? range : OptionalFrameSet.unbounded();
        Set<Integer> active = new TreeSet<>();
        for (int frame : frames) {
            if (r.contains(frame)) {
                active.add(frame);
            }
        }
        return Collections.unmodifiableSet(active);
    }

    public int length() {
        return indexToFrame.size();
    }

    public int indexToFrame(int index) {
        if (index < 0 || index >= indexToFrame.size()) {
            throw new IndexOutOfBoundsException("Frame index " + index + " outside [0, " + indexToFrame.size() + ")");
        }
        return indexToFrame.get(index);
    }

    public boolean contains(int frame) {
        return activeFrames.contains(frame);
    }

    /**
     * Active frames in ascending order.
     */
    public List<Integer> frames() {
        return new ArrayList<>(activeFrames);
    }

    public FrameRange intersection(OptionalFrameSet other) {
        Set<Integer> narrowed = new TreeSet<>();
        for (int frame : activeFrames) {
            if (other == null || other.contains(frame)) {
                narrowed.add(frame);
            }
        }
        return new FrameRange(indexToFrame, Collections.unmodifiableSet(narrowed));
    }

    @Override
    public String toString() {
        return "FrameRange{length=" + length() + ", active=" + activeFrames.size() + "}";
    }
}
