package com.videodepth.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoDepthServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideoDepthServerApplication.class, args);
    }
}
