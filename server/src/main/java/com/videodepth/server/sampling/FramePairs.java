package com.videodepth.server.sampling;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class FramePairs {

    public static final Comparator<FramePair> ORDER = Comparator.comparingInt(FramePair::getFirst)
            .thenComparingInt(FramePair::getSecond);

    private FramePairs() {
    }

    /**
     * Collapses each pair and its reverse to a single pair with
     * {@code first <= second}.
     */
    public static Set<FramePair> toOneWay(Collection<FramePair> pairs) {
        Set<FramePair> oneWay = new HashSet<>();
        for (FramePair pair : pairs) {
            oneWay.add(pair.getFirst() > pair.getSecond() ? pair.reversed() : pair);
        }
        return oneWay;
    }

    /**
     * Keeps the pairs whose both frames lie in {@code [from, to)}.
     */
    public static List<FramePair> toInRange(Collection<FramePair> pairs, int from, int to) {
        List<FramePair> inRange = new ArrayList<>();
        for (FramePair pair : pairs) {
            if (inRange(pair.getFirst(), from, to) && inRange(pair.getSecond(), from, to)) {
                inRange.add(pair);
            }
        }
        return inRange;
    }

    public static List<FramePair> sorted(Collection<FramePair> pairs) {
        List<FramePair> list = new ArrayList<>(pairs);
        list.sort(ORDER);
        return list;
    }

    private static boolean inRange(int frame, int from, int to) {
        return from <= frame && frame < to;
    }
}
