package com.example.est.controller;

import com.example.est.dto.AngleSetResponse;
import com.example.est.dto.ImageResult;
import com.example.est.dto.ReconstructionResponse;
import com.example.est.service.AngleSetCacheService;
import com.example.est.service.ReconstructionService;
import com.example.est.tomography.AngleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.time.ZoneId;

@RestController
public class ReconstructionController {

    private static final Logger logger = LoggerFactory.getLogger(ReconstructionController.class);

    private final ReconstructionService reconstructionService;
    private final AngleSetCacheService angleSetCacheService;

    public ReconstructionController(ReconstructionService reconstructionService,
                                    AngleSetCacheService angleSetCacheService) {
        this.reconstructionService = reconstructionService;
        this.angleSetCacheService = angleSetCacheService;
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("OK");
    }

    @GetMapping(value = "/est/angles", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AngleSetResponse> angles(@RequestParam("count") int count) {
        AngleSet angles = angleSetCacheService.getAngles(count);
        return ResponseEntity.ok(new AngleSetResponse(angles.size(), angles.toArray()));
    }

    @PostMapping(
            value = "/est/reconstruct",
            consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ReconstructionResponse> reconstruct(
            @RequestBody byte[] rawSignal,
            @RequestHeader("X-Projections") int projections,
            @RequestHeader(value = "X-Detectors", required = false) Integer detectors,
            @RequestHeader(value = "X-Iterations", required = false) Integer iterations,
            @RequestHeader(value = "X-Tolerance", required = false) Double tolerance,
            @RequestHeader(value = "X-Learning-Rate", required = false) Double learningRate
    ) {
        ImageResult result = reconstructionService.reconstruct(
                rawSignal, projections, detectors, iterations, tolerance, learningRate
        );

        ZoneId zone = ZoneId.systemDefault();
        ReconstructionResponse response = new ReconstructionResponse(
                result.algoritmo(),
                result.startTime().atZone(zone),
                result.endTime().atZone(zone),
                Math.round(result.tempoSegundos() * 1000.0),
                result.tamanho(),
                result.iteracoes(),
                result.terminacao(),
                result.erroFinal(),
                result.cpuPercent(),
                result.memPercent(),
                result.trace(),
                result.pixels()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Iterations", String.valueOf(result.iteracoes()));
        headers.add("X-Termination", result.terminacao());
        headers.add("X-Cpu", String.format("%.1f", result.cpuPercent()));
        headers.add("X-Mem", String.format("%.1f", result.memPercent()));

        return ResponseEntity.ok()
                .headers(headers)
                .body(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> invalidRequest(IllegalArgumentException e) {
        logger.warn("Requisição rejeitada: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(e.getMessage());
    }
}
