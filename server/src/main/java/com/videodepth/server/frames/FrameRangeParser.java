package com.videodepth.server.frames;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses frame range names as given on the command line, e.g.
 * {@code "0-10,15,20-22"}. Bounds are inclusive. A blank name or {@code "all"}
 * means no restriction.
 */
public final class FrameRangeParser {

    private FrameRangeParser() {
    }

    public static OptionalFrameSet parse(String text) {
        if (text == null || text.trim().isEmpty() || "all".equals(text.trim().toLowerCase(Locale.ROOT))) {
            return OptionalFrameSet.unbounded();
        }
        String name = text.trim();
        List<OptionalFrameSet.Interval> intervals = new ArrayList<>();
        for (String part : name.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) {
                throw new IllegalArgumentException("Empty element in frame range '" + text + "'");
            }
            int dash = token.indexOf('-', 1);
            if (dash < 0) {
                int frame = parseFrame(token, text);
                intervals.add(new OptionalFrameSet.Interval(frame, frame));
                continue;
            }
            int from = parseFrame(token.substring(0, dash), text);
            int to = parseFrame(token.substring(dash + 1), text);
            if (to < from) {
                throw new IllegalArgumentException("Descending range '" + token + "' in frame range '" + text + "'");
            }
            intervals.add(new OptionalFrameSet.Interval(from, to));
        }
        return OptionalFrameSet.ofIntervals(name, intervals);
    }

    private static int parseFrame(String token, String text) {
        int frame;
        try {
            frame = Integer.parseInt(token.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid frame '" + token + "' in frame range '" + text + "'", e);
        }
        if (frame < 0) {
            throw new IllegalArgumentException("Negative frame " + frame + " in frame range '" + text + "'");
        }
        return frame;
    }
}
