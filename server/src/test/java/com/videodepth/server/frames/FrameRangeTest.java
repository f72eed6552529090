package com.videodepth.server.frames;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FrameRangeTest {

    @Test
    public void testRangeClippedToFrameCount() {
        FrameRange range = new FrameRange(OptionalFrameSet.of(List.of(2, 5, 12)), 10);
        assertEquals(10, range.length());
        assertEquals(List.of(2, 5), range.frames());
        assertFalse(range.contains(12));
        assertEquals(7, range.indexToFrame(7));
    }

    @Test
    public void testIndexOutsideRangeFails() {
        FrameRange range = FrameRange.all(3);
        assertThrows(IndexOutOfBoundsException.class, () -> range.indexToFrame(3));
        assertThrows(IndexOutOfBoundsException.class, () -> range.indexToFrame(-1));
    }

    @Test
    public void testIntersectionKeepsIndexSpace() {
        FrameRange range = FrameRange.all(6);
        FrameRange narrowed = range.intersection(OptionalFrameSet.of(List.of(1, 4, 9)));
        assertEquals(6, narrowed.length());
        assertEquals(List.of(1, 4), narrowed.frames());
        assertEquals(List.of(0, 1, 2, 3, 4, 5), range.frames());
        assertEquals(List.of(1, 4), narrowed.intersection(OptionalFrameSet.unbounded()).frames());
    }

    @Test
    public void testExplicitFrameList() {
        FrameRange range = FrameRange.ofFrames(List.of(3, 7, 11), OptionalFrameSet.of(List.of(7)));
        assertEquals(3, range.length());
        assertEquals(11, range.indexToFrame(2));
        assertEquals(List.of(7), range.frames());
        assertThrows(IllegalArgumentException.class,
                () -> FrameRange.ofFrames(List.of(1, 1), OptionalFrameSet.unbounded()));
    }

    @Test
    public void testNegativeFrameCountFails() {
        assertThrows(IllegalArgumentException.class, () -> FrameRange.all(-1));
    }

    @Test
    public void testOptionalSetIntersection() {
        OptionalFrameSet all = OptionalFrameSet.unbounded();
        OptionalFrameSet some = OptionalFrameSet.of(List.of(1, 2, 3));
        assertSame(some, all.intersection(some));
        assertSame(some, some.intersection(all));
        assertEquals(OptionalFrameSet.of(List.of(2, 3)), some.intersection(OptionalFrameSet.of(List.of(2, 3, 4))));
        assertTrue(all.contains(123456));
        assertNull(all.getIntervals());
        assertEquals(Set.of(0, 1, 2), all.framesBelow(3));
    }

    @Test
    public void testIntervalIntersection() {
        OptionalFrameSet a = FrameRangeParser.parse("0-10,20-30");
        OptionalFrameSet b = FrameRangeParser.parse("5-25");
        OptionalFrameSet common = a.intersection(b);
        assertEquals(List.of(new OptionalFrameSet.Interval(5, 10), new OptionalFrameSet.Interval(20, 25)),
                common.getIntervals());
        assertTrue(common.contains(22));
        assertFalse(common.contains(15));
    }
}
