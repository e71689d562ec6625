package com.example.est.config;

import com.example.est.tomography.ReconstructionSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@ConfigurationProperties(prefix = "est")
public record EstProperties(
        @DefaultValue("200") int iterations,
        @DefaultValue("1e-5") double tolerance,
        @DefaultValue("5e-5") double learningRate,
        @DefaultValue("true") boolean parallel,
        @DefaultValue("10") int progressLogInterval,
        @DefaultValue({"60", "90", "180"}) List<Integer> preloadAngleCounts,
        @DefaultValue("4096") int maxProjections
) {

    public ReconstructionSettings toSettings() {
        return new ReconstructionSettings(iterations, tolerance, learningRate);
    }
}
