package com.example.est.config;

import com.example.est.tomography.AngleSampler;
import com.example.est.tomography.BackprojectionOperator;
import com.example.est.tomography.FilteredBackprojectionInitializer;
import com.example.est.tomography.ImageRotator;
import com.example.est.tomography.ProjectionOperator;
import com.example.est.tomography.ReconstructionEngine;
import com.example.est.tomography.ReconstructionInitializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EstProperties.class)
public class EstConfiguration {

    @Bean
    public AngleSampler angleSampler() {
        return new AngleSampler();
    }

    @Bean
    public ImageRotator imageRotator() {
        return new ImageRotator();
    }

    @Bean
    public ProjectionOperator projectionOperator(ImageRotator rotator, EstProperties properties) {
        return new ProjectionOperator(rotator, properties.parallel());
    }

    @Bean
    public BackprojectionOperator backprojectionOperator(ImageRotator rotator, EstProperties properties) {
        return new BackprojectionOperator(rotator, properties.parallel());
    }

    @Bean
    public ReconstructionInitializer reconstructionInitializer(BackprojectionOperator backprojector) {
        return new FilteredBackprojectionInitializer(backprojector);
    }

    @Bean
    public ReconstructionEngine reconstructionEngine(ProjectionOperator projector,
                                                     BackprojectionOperator backprojector,
                                                     ReconstructionInitializer initializer) {
        return new ReconstructionEngine(projector, backprojector, initializer);
    }
}
