package com.videodepth.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.videodepth.server.sampling.SamplingMode;
import com.videodepth.server.sampling.SamplingParams;
import com.videodepth.server.sampling.SamplingRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Root of sampling_config.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SamplingConfig {

    public String data_directory;
    public boolean twoWay = true;
    public List<String> flowOps = new ArrayList<>(List.of("hierarchical2"));
    public boolean persistRuns = false;
    // Explicit requests take precedence over flowOps when present
    public List<RequestConfig> requests;

    public static class RequestConfig {
        public String mode;
        public Map<String, Object> params;

        public SamplingRequest toRequest() {
            return new SamplingRequest(SamplingMode.fromName(mode), SamplingParams.fromMap(params));
        }
    }

    public static SamplingConfig defaults() {
        return new SamplingConfig();
    }

    public List<SamplingRequest> toRequests() {
        List<SamplingRequest> result = new ArrayList<>();
        if (requests != null && !requests.isEmpty()) {
            for (RequestConfig rc : requests) {
                result.add(rc.toRequest());
            }
            return result;
        }
        for (String op : flowOps) {
            result.add(SamplingRequest.of(SamplingMode.fromName(op)));
        }
        return result;
    }
}
