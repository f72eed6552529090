package com.videodepth.server.service;

import com.videodepth.db.SamplingRunDao;
import com.videodepth.db.SqliteInitializer;
import com.videodepth.server.config.SamplingConfig;
import com.videodepth.server.config.SamplingConfigLoader;
import com.videodepth.server.frames.FrameRange;
import com.videodepth.server.frames.FrameRangeParser;
import com.videodepth.server.frames.OptionalFrameSet;
import com.videodepth.server.sampling.FramePair;
import com.videodepth.server.sampling.FramePairs;
import com.videodepth.server.sampling.PairSampler;
import com.videodepth.server.sampling.SamplingMode;
import com.videodepth.server.sampling.SamplingRequest;
import com.videodepth.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class PairSamplingService {

    private static final Logger logger = LoggerFactory.getLogger(PairSamplingService.class);

    private final SamplingConfig config;
    // null when runs are not persisted
    private final SamplingRunDao runDao;

    @Autowired
    public PairSamplingService() {
        this(SamplingConfigLoader.loadOrDefault(), null);
    }

    public PairSamplingService(SamplingConfig config, String dbPath) {
        this.config = config != null ? config : SamplingConfig.defaults();
        if (this.config.persistRuns) {
            String path = dbPath != null ? dbPath : DataPathResolver.resolveDbPath(this.config);
            try {
                SqliteInitializer.initialize(path);
                logger.info("Initialized SQLite pair cache at {}", path);
            } catch (SQLException e) {
                logger.error("Failed to initialize SQLite", e);
                throw new RuntimeException(e);
            }
            this.runDao = new SamplingRunDao(path);
        } else {
            this.runDao = null;
        }
    }

    public SamplingConfig getConfig() {
        return config;
    }

    public List<String> modeNames() {
        return SamplingMode.names();
    }

    /**
     * Samples frame pairs over {@code numFrames} frames.
     *
     * @param rangeName   frame range such as "0-99"; null or blank for all frames
     * @param validFrames frames that passed upstream checks; null keeps the range as is
     * @param flowOps     sampling mode names; null or empty uses the configured requests
     * @param twoWay      null uses the configured direction
     * @param oneWay      collapse each pair and its reverse into one
     */
    public SamplingResult sample(int numFrames, String rangeName, List<Integer> validFrames, List<String> flowOps,
            Boolean twoWay, boolean oneWay) {
        OptionalFrameSet range = FrameRangeParser.parse(rangeName);
        FrameRange frameRange = new FrameRange(range, numFrames);

        List<Integer> filteredOut = new ArrayList<>();
        if (validFrames != null) {
            FrameRange narrowed = frameRange.intersection(OptionalFrameSet.of(validFrames));
            for (int frame : frameRange.frames()) {
                if (!narrowed.contains(frame)) {
                    filteredOut.add(frame);
                }
            }
            logger.info("Filtered out frames {}", filteredOut);
            frameRange = narrowed;
        }

        List<SamplingRequest> requests = resolveRequests(flowOps);
        boolean direction = twoWay != null ? twoWay : config.twoWay;

        Set<FramePair> pairs = PairSampler.sample(requests, frameRange, direction);
        if (oneWay) {
            pairs = FramePairs.toOneWay(pairs);
        }
        List<FramePair> sorted = FramePairs.sorted(pairs);

        String runKey = runKey(numFrames, range, validFrames, requests, direction, oneWay);
        if (runDao != null) {
            try {
                runDao.upsertRun(runKey, describe(requests), direction, sorted);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to persist sampling run " + runKey, e);
            }
        }
        return new SamplingResult(sorted, filteredOut, runKey);
    }

    private List<SamplingRequest> resolveRequests(List<String> flowOps) {
        if (flowOps == null || flowOps.isEmpty()) {
            return config.toRequests();
        }
        List<SamplingRequest> requests = new ArrayList<>();
        for (String op : flowOps) {
            requests.add(SamplingRequest.of(SamplingMode.fromName(op)));
        }
        return requests;
    }

    private static String describe(List<SamplingRequest> requests) {
        return requests.stream()
                .map(r -> r.getParams().isEmpty() ? r.getMode().modeName()
                        : r.getMode().modeName() + r.getParams())
                .collect(Collectors.joining("-"));
    }

    static String runKey(int numFrames, OptionalFrameSet range, List<Integer> validFrames,
            List<SamplingRequest> requests, boolean twoWay, boolean oneWay) {
        String raw = numFrames + "|" + range.getIntervals() + "|" + validFrames + "|" + describe(requests) + "|"
                + twoWay + "|" + oneWay;
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(raw.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
