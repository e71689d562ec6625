package com.example.est.service;

import com.example.est.config.EstProperties;
import com.example.est.dto.ImageResult;
import com.example.est.tomography.AngleSet;
import com.example.est.tomography.ReconstructionEngine;
import com.example.est.tomography.ReconstructionListener;
import com.example.est.tomography.ReconstructionResult;
import com.example.est.tomography.ReconstructionSettings;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.time.LocalDateTime;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class ReconstructionService {

    private final AngleSetCacheService angleSetCacheService;
    private final ReconstructionEngine engine;
    private final EstProperties properties;
    private final SystemInfo systemInfo;
    private final CentralProcessor processor;

    private final ReentrantLock cpuLock = new ReentrantLock();
    private long[] prevTicks;

    private static final Logger logger = LoggerFactory.getLogger(ReconstructionService.class);
    private static final String ALGORITHM = "EST";

    public ReconstructionService(AngleSetCacheService angleSetCacheService,
                                 ReconstructionEngine engine,
                                 EstProperties properties) {
        this.angleSetCacheService = angleSetCacheService;
        this.engine = engine;
        this.properties = properties;
        this.systemInfo = new SystemInfo();
        this.processor = systemInfo.getHardware().getProcessor();
        this.prevTicks = processor.getSystemCpuLoadTicks();
    }

    public ImageResult reconstruct(byte[] rawSignal, int projections, Integer detectors,
                                   Integer iterations, Double tolerance, Double learningRate) {
        logger.info("Iniciando reconstrução. Projeções={}, DetectoresHeader={}, Iterações={}, Tolerância={}, Taxa={}",
                projections, detectors, iterations, tolerance, learningRate);
        LocalDateTime startTime = LocalDateTime.now();
        long startNanos = System.nanoTime();

        INDArray sinogram = toSinogram(rawSignal, projections, detectors);
        AngleSet angles = angleSetCacheService.getAngles(projections);
        ReconstructionSettings settings = resolveSettings(iterations, tolerance, learningRate);

        ReconstructionResult result = engine.reconstruct(sinogram, angles, settings, progressLogger());

        double cpuPercent = getCpuUsage();
        GlobalMemory memory = systemInfo.getHardware().getMemory();
        double memPercent = (memory.getTotal() - memory.getAvailable()) * 100.0 / memory.getTotal();

        INDArray image = result.image();
        int lado = (int) image.rows();

        LocalDateTime endTime = LocalDateTime.now();
        long endNanos = System.nanoTime();
        double durationSeconds = (endNanos - startNanos) / 1_000_000_000.0;

        logger.info("Reconstrução concluída: {} após {} iterações, erro máximo {} ({} s)",
                result.terminationReason(), result.iterationsExecuted(),
                String.format("%.4e", result.finalMaxError()), String.format("%.3f", durationSeconds));

        return new ImageResult(
                image.toDoubleMatrix(),
                ALGORITHM,
                lado + "x" + lado,
                result.iterationsExecuted(),
                result.terminationReason().name(),
                result.finalMaxError(),
                result.trace(),
                durationSeconds,
                cpuPercent,
                memPercent,
                startTime,
                endTime
        );
    }

    ReconstructionSettings resolveSettings(Integer iterations, Double tolerance, Double learningRate) {
        ReconstructionSettings settings = properties.toSettings();
        if (iterations != null) {
            settings = settings.withIterations(iterations);
        }
        if (tolerance != null) {
            settings = settings.withTolerance(tolerance);
        }
        if (learningRate != null) {
            settings = settings.withLearningRate(learningRate);
        }
        return settings;
    }

    INDArray toSinogram(byte[] rawSignal, int projections, Integer detectors) {
        if (rawSignal == null || rawSignal.length == 0 || rawSignal.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Sinal deve conter valores float32, recebido "
                    + (rawSignal == null ? 0 : rawSignal.length) + " bytes");
        }
        if (projections < 1) {
            throw new IllegalArgumentException("Número de projeções inválido: " + projections);
        }
        float[] floatArr = bytesToFloatArrayLE(rawSignal);

        int columns;
        if (detectors != null) {
            columns = detectors;
            if (columns < 1 || (long) projections * columns != floatArr.length) {
                throw new IllegalArgumentException("Tamanho incorreto do sinal: esperado "
                        + projections + "x" + detectors + ", recebido " + floatArr.length);
            }
        } else {
            if (floatArr.length % projections != 0) {
                throw new IllegalArgumentException("Sinal de " + floatArr.length
                        + " valores não é divisível em " + projections + " projeções");
            }
            columns = floatArr.length / projections;
        }

        double[][] rows = new double[projections][columns];
        for (int k = 0; k < floatArr.length; k++) {
            rows[k / columns][k % columns] = floatArr[k];
        }
        return Nd4j.createFromArray(rows);
    }

    private ReconstructionListener progressLogger() {
        int interval = Math.max(1, properties.progressLogInterval());
        return record -> {
            if (record.iteration() % interval == 0) {
                logger.info("[ITERAÇÃO {}] erro máximo: {}", record.iteration(), String.format("%.4e", record.maxError()));
            } else {
                logger.debug("[ITERAÇÃO {}] erro máximo: {}", record.iteration(), record.maxError());
            }
        };
    }

    private float[] bytesToFloatArrayLE(byte[] raw) {
        ByteBuffer bb = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        FloatBuffer fb = bb.asFloatBuffer();
        float[] arr = new float[fb.remaining()];
        fb.get(arr);
        return arr;
    }

    private double getCpuUsage() {
        cpuLock.lock();
        try {
            double load = processor.getSystemCpuLoadBetweenTicks(this.prevTicks) * 100.0;
            this.prevTicks = processor.getSystemCpuLoadTicks();
            return load;
        } finally {
            cpuLock.unlock();
        }
    }
}
