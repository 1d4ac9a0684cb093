package com.tracegraph.visualizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TraceGraphVisualizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceGraphVisualizerApplication.class, args);
    }
}
