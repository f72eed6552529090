package com.videodepth.server.sampling;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named, optional, mode-specific parameters of a {@link SamplingRequest}.
 * A missing value means "use the mode default". Values are only checked when a
 * generator reads them, so a params object can be built before the mode that
 * will consume it is known.
 */
public final class SamplingParams {

    public static final String MIN_DIST = "min_dist";
    public static final String MAX_DIST = "max_dist";
    public static final String INCLUDE_MID_POINT = "include_mid_point";

    private static final SamplingParams EMPTY = new SamplingParams(Collections.emptyMap());

    private final Map<String, Object> values;

    private SamplingParams(Map<String, Object> values) {
        this.values = values;
    }

    public static SamplingParams empty() {
        return EMPTY;
    }

    public static SamplingParams fromMap(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return EMPTY;
        }
        return new SamplingParams(Collections.unmodifiableMap(new LinkedHashMap<>(params)));
    }

    public static SamplingParams distances(Integer minDist, Integer maxDist) {
        return empty().with(MIN_DIST, minDist).with(MAX_DIST, maxDist);
    }

    public SamplingParams withMinDist(int minDist) {
        return with(MIN_DIST, minDist);
    }

    public SamplingParams withMaxDist(int maxDist) {
        return with(MAX_DIST, maxDist);
    }

    public SamplingParams withIncludeMidPoint(boolean includeMidPoint) {
        return with(INCLUDE_MID_POINT, includeMidPoint);
    }

    private SamplingParams with(String key, Object value) {
        if (value == null) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new SamplingParams(Collections.unmodifiableMap(copy));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Integer getMinDist() {
        return intValue(MIN_DIST);
    }

    public Integer getMaxDist() {
        return intValue(MAX_DIST);
    }

    public Boolean getIncludeMidPoint() {
        Object value = values.get(INCLUDE_MID_POINT);
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException(INCLUDE_MID_POINT + " must be a boolean, got " + value);
    }

    private Integer intValue(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                return Math.toIntExact(((Number) value).longValue());
            }
            if (value instanceof Number) {
                double d = ((Number) value).doubleValue();
                if (d == Math.rint(d) && !Double.isInfinite(d)) {
                    return Math.toIntExact((long) d);
                }
            }
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " out of int range, got " + value, e);
        }
        throw new IllegalArgumentException(key + " must be an integer, got " + value);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SamplingParams && values.equals(((SamplingParams) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
