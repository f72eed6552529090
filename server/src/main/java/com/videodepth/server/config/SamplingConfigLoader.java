package com.videodepth.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

public class SamplingConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(SamplingConfigLoader.class);
    public static final String CONFIG_RESOURCE = "/sampling_config.json";

    public static SamplingConfig load(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        SamplingConfig config = mapper.readValue(jsonStream, SamplingConfig.class);
        if (config.flowOps == null || config.flowOps.isEmpty()) {
            logger.warn("No flowOps configured, defaulting to {}", SamplingConfig.defaults().flowOps);
            config.flowOps = SamplingConfig.defaults().flowOps;
        }
        return config;
    }

    public static SamplingConfig loadOrDefault() {
        return loadOrDefault(CONFIG_RESOURCE);
    }

    public static SamplingConfig loadOrDefault(String resource) {
        try (InputStream is = SamplingConfigLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using default sampling config", resource);
                return SamplingConfig.defaults();
            }
            return load(is);
        } catch (IOException e) {
            logger.warn("Failed to read {}, using default sampling config: {}", resource, e.getMessage());
            return SamplingConfig.defaults();
        }
    }
}
