package com.videodepth.server.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
public class PairSamplingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    public void testSamplingModes() throws Exception {
        mockMvc.perform(get("/sampling-modes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", contains("exhausted", "consecutive", "hierarchical", "hierarchical2")));
    }

    @Test
    public void testSamplePairs() throws Exception {
        String body = "{\"numFrames\": 5, \"flowOps\": [\"consecutive\"], \"oneWay\": true}";
        mockMvc.perform(post("/sample-pairs").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(4)))
                .andExpect(jsonPath("$.pairs[0]", contains(0, 1)))
                .andExpect(jsonPath("$.pairs[3]", contains(3, 4)));
    }

    @Test
    public void testValidFramesReported() throws Exception {
        String body = "{\"numFrames\": 5, \"validFrames\": [0, 2, 4], \"flowOps\": [\"consecutive\"]}";
        mockMvc.perform(post("/sample-pairs").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(8)))
                .andExpect(jsonPath("$.filteredOutFrames", contains(1, 3)));
    }

    @Test
    public void testWideFrameRangeClippedToClip() throws Exception {
        String body = "{\"numFrames\": 5, \"frameRange\": \"0-2147483647\", \"flowOps\": [\"consecutive\"]}";
        mockMvc.perform(post("/sample-pairs").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(8)));
    }

    @Test
    public void testUnknownModeIsBadRequest() throws Exception {
        String body = "{\"numFrames\": 5, \"flowOps\": [\"dense\"]}";
        mockMvc.perform(post("/sample-pairs").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testMissingFrameCountIsBadRequest() throws Exception {
        mockMvc.perform(post("/sample-pairs").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testNegativeFrameCountIsBadRequest() throws Exception {
        String body = "{\"numFrames\": -2, \"flowOps\": [\"consecutive\"]}";
        mockMvc.perform(post("/sample-pairs").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }
}
