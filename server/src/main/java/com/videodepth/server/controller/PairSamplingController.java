package com.videodepth.server.controller;

import com.videodepth.server.sampling.FramePair;
import com.videodepth.server.service.PairSamplingService;
import com.videodepth.server.service.SamplingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class PairSamplingController {

    private static final Logger logger = LoggerFactory.getLogger(PairSamplingController.class);
    private final PairSamplingService samplingService;

    public PairSamplingController(PairSamplingService samplingService) {
        this.samplingService = samplingService;
    }

    public static class SamplePairsRequest {
        public Integer numFrames;
        // e.g. "0-99,120"; all frames when missing
        public String frameRange;
        public List<Integer> validFrames;
        public List<String> flowOps;
        public Boolean twoWay;
        public boolean oneWay = false;
    }

    @GetMapping("/sampling-modes")
    public List<String> samplingModes() {
        return samplingService.modeNames();
    }

    @PostMapping("/sample-pairs")
    public ResponseEntity<?> samplePairs(@RequestBody SamplePairsRequest request) {
        if (request.numFrames == null) {
            return ResponseEntity.badRequest().body("numFrames is required.");
        }

        logger.info("Received pair sampling request: numFrames={}, range={}, ops={}", request.numFrames,
                request.frameRange, request.flowOps);

        SamplingResult result;
        try {
            result = samplingService.sample(request.numFrames, request.frameRange, request.validFrames,
                    request.flowOps, request.twoWay, request.oneWay);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected pair sampling request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }

        int[][] pairs = new int[result.getCount()][];
        for (int i = 0; i < pairs.length; i++) {
            FramePair pair = result.getPairs().get(i);
            pairs[i] = new int[] { pair.getFirst(), pair.getSecond() };
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", pairs.length);
        body.put("pairs", pairs);
        body.put("filteredOutFrames", result.getFilteredOutFrames());
        body.put("runKey", result.getRunKey());
        return ResponseEntity.ok(body);
    }
}
