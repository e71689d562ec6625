package com.example.est.service;

import com.example.est.config.EstProperties;
import com.example.est.tomography.AngleSampler;
import com.example.est.tomography.AngleSet;
import com.example.est.tomography.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class AngleSetCacheService {

    private static final Logger logger = LoggerFactory.getLogger(AngleSetCacheService.class);

    private final AngleSampler angleSampler;
    private final EstProperties properties;
    private final Map<Integer, AngleSet> angleCache = new ConcurrentHashMap<>();

    public AngleSetCacheService(AngleSampler angleSampler, EstProperties properties) {
        this.angleSampler = angleSampler;
        this.properties = properties;
    }

    @PostConstruct
    public void preloadAngleSets() {
        logger.info("=== INICIANDO PRÉ-CÁLCULO DOS CONJUNTOS DE ÂNGULOS ===");

        for (Integer count : properties.preloadAngleCounts()) {
            try {
                AngleSet angles = getAngles(count);
                angleCache.putIfAbsent(count, angles);
                logger.info(" - [ÂNGULOS] {} projeções: [{}, {}] graus",
                        count, angles.get(0), angles.get(angles.size() - 1));
            } catch (IllegalArgumentException e) {
                logger.error("[ERRO] Quantidade de projeções inválida na configuração: {}", e.getMessage());
            }
        }

        logger.info("=== CONJUNTOS DE ÂNGULOS PRÉ-CALCULADOS ===");
    }

    public AngleSet getAngles(int projections) {
        if (projections > properties.maxProjections()) {
            throw new InvalidConfigurationException("Número de projeções " + projections
                    + " excede o máximo configurado (" + properties.maxProjections() + ")");
        }
        AngleSet cached = angleCache.get(projections);
        if (cached != null) {
            return cached;
        }
        // só as quantidades pré-carregadas ficam no cache
        return angleSampler.sample(projections);
    }

    public boolean isCached(int projections) {
        return angleCache.containsKey(projections);
    }
}
