package com.videodepth.server.tools;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.videodepth.server.frames.FrameRange;
import com.videodepth.server.frames.FrameRangeParser;
import com.videodepth.server.sampling.FramePair;
import com.videodepth.server.sampling.FramePairs;
import com.videodepth.server.sampling.PairSampler;
import com.videodepth.server.sampling.SamplingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offline tool that prints the sampled frame pairs of a clip as JSON, in the
 * shape of flow_list.json.
 * Usage: PairListExport <numFrames> [frameRange] [op,op,...]
 */
public class PairListExport {

    private static final Logger logger = LoggerFactory.getLogger(PairListExport.class);
    private static final String DEFAULT_OPS = "hierarchical2";

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: PairListExport <numFrames> [frameRange] [op,op,...]");
            System.err.println("Available ops: " + SamplingMode.names());
            System.exit(1);
        }

        try {
            int numFrames = Integer.parseInt(args[0]);
            String range = args.length > 1 ? args[1] : null;
            List<String> ops = Arrays.asList((args.length > 2 ? args[2] : DEFAULT_OPS).split(","));
            export(numFrames, range, ops, System.out);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            logger.error("Failed to write pair list", e);
            System.exit(2);
        }
    }

    public static List<FramePair> export(int numFrames, String range, List<String> ops, OutputStream out)
            throws IOException {
        FrameRange frameRange = new FrameRange(FrameRangeParser.parse(range), numFrames);
        List<FramePair> pairs = FramePairs.sorted(PairSampler.samplePairs(frameRange, ops));
        logger.info("Exporting {} pairs for ops {}", pairs.size(), ops);

        List<int[]> rows = new ArrayList<>(pairs.size());
        for (FramePair pair : pairs) {
            rows.add(new int[] { pair.getFirst(), pair.getSecond() });
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("pairs", rows);

        // out may be System.out, keep it open
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        mapper.writeValue(out, root);
        out.flush();
        return pairs;
    }
}
