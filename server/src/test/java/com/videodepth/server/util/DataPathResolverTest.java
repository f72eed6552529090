package com.videodepth.server.util;

import com.videodepth.server.config.SamplingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

public class DataPathResolverTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(DataPathResolver.DATA_DIR_PROPERTY);
    }

    @Test
    public void testSystemPropertyWins() {
        System.setProperty(DataPathResolver.DATA_DIR_PROPERTY, "/tmp/clips");
        assertEquals("/tmp/clips", DataPathResolver.resolveDataDirectory());
        assertEquals("/tmp/clips" + File.separator + "pair_cache.db", DataPathResolver.resolveDbPath());
    }

    @Test
    public void testConfigDirectoryUsedWithoutProperty() {
        // test sampling_config.json sets data_directory to "."
        assertEquals(".", DataPathResolver.resolveDataDirectory());
    }

    @Test
    public void testDirectoryFromLoadedConfig() {
        SamplingConfig config = SamplingConfig.defaults();
        config.data_directory = "/data/clip7";
        assertEquals("/data/clip7" + File.separator + "pair_cache.db", DataPathResolver.resolveDbPath(config));

        config.data_directory = null;
        assertEquals(".", DataPathResolver.resolveDataDirectory(config));
    }
}
