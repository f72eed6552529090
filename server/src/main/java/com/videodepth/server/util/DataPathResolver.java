package com.videodepth.server.util;

import com.videodepth.server.config.SamplingConfig;
import com.videodepth.server.config.SamplingConfigLoader;

import java.io.File;

/**
 * Locates the directory holding the pair cache: the {@value #DATA_DIR_PROPERTY}
 * system property, else {@code data_directory} from the sampling config, else
 * the working directory.
 */
public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "videodepth.data.dir";
    public static final String DB_FILE = "pair_cache.db";

    public static String resolveDataDirectory() {
        return resolveDataDirectory(SamplingConfigLoader.loadOrDefault());
    }

    public static String resolveDataDirectory(SamplingConfig config) {
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }
        if (config != null && config.data_directory != null && !config.data_directory.isEmpty()) {
            return config.data_directory;
        }
        return ".";
    }

    public static String resolveDbPath(SamplingConfig config) {
        return resolveDataDirectory(config) + File.separator + DB_FILE;
    }

    public static String resolveDbPath() {
        return resolveDataDirectory() + File.separator + DB_FILE;
    }
}
