package com.videodepth.server.sampling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pairing strategies. Names are the lower-case constant names and are what
 * users type as flow ops (e.g. "hierarchical2").
 */
public enum SamplingMode {
    EXHAUSTED,
    CONSECUTIVE,
    HIERARCHICAL,
    // hierarchical with midpoints
    HIERARCHICAL2;

    private static final Map<String, SamplingMode> NAME_MODE_MAP;

    static {
        Map<String, SamplingMode> map = new LinkedHashMap<>();
        for (SamplingMode mode : values()) {
            map.put(mode.modeName(), mode);
        }
        NAME_MODE_MAP = Collections.unmodifiableMap(map);
    }

    public String modeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Map<String, SamplingMode> nameModeMap() {
        return NAME_MODE_MAP;
    }

    public static List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(NAME_MODE_MAP.keySet()));
    }

    public static SamplingMode fromName(String name) {
        SamplingMode mode = name == null ? null : NAME_MODE_MAP.get(name.trim().toLowerCase(Locale.ROOT));
        if (mode == null) {
            throw new IllegalArgumentException("Unknown sampling mode '" + name + "', expected one of " + names());
        }
        return mode;
    }
}
