package com.example.est.controller;

import com.example.est.dto.ImageResult;
import com.example.est.service.AngleSetCacheService;
import com.example.est.service.ReconstructionService;
import com.example.est.tomography.AngleSet;
import com.example.est.tomography.InvalidConfigurationException;
import com.example.est.tomography.IterationRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReconstructionController.class)
class ReconstructionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReconstructionService reconstructionService;

    @MockBean
    private AngleSetCacheService angleSetCacheService;

    @Test
    void ping() throws Exception {
        mockMvc.perform(get("/ping"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }

    @Test
    void listsAngles() throws Exception {
        when(angleSetCacheService.getAngles(3)).thenReturn(AngleSet.of(-90.0, 0.0, 90.0));

        mockMvc.perform(get("/est/angles").param("count", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.angles[0]").value(-90.0))
                .andExpect(jsonPath("$.angles[1]").value(0.0));
    }

    @Test
    void invalidAngleCountIsBadRequest() throws Exception {
        when(angleSetCacheService.getAngles(1)).thenThrow(new InvalidConfigurationException("angulos insuficientes"));

        mockMvc.perform(get("/est/angles").param("count", "1"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("angulos insuficientes"));
    }

    @Test
    void angleCountAboveMaximumIsBadRequest() throws Exception {
        when(angleSetCacheService.getAngles(Integer.MAX_VALUE - 8))
                .thenThrow(new InvalidConfigurationException("excede o maximo configurado"));

        mockMvc.perform(get("/est/angles").param("count", String.valueOf(Integer.MAX_VALUE - 8)))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("excede o maximo configurado"));
    }

    @Test
    void reconstructReturnsJsonBody() throws Exception {
        LocalDateTime start = LocalDateTime.of(2024, 5, 1, 10, 0, 0);
        ImageResult result = new ImageResult(
                new double[][]{{0.0, 1.0}, {2.0, 0.5}},
                "EST",
                "2x2",
                2,
                "CONVERGED",
                0.0,
                List.of(new IterationRecord(1, 0.0), new IterationRecord(2, 0.0)),
                0.25,
                12.5,
                40.0,
                start,
                start);
        when(reconstructionService.reconstruct(any(), eq(4), eq(2), isNull(), isNull(), eq(0.01)))
                .thenReturn(result);

        mockMvc.perform(post("/est/reconstruct")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[32])
                        .header("X-Projections", "4")
                        .header("X-Detectors", "2")
                        .header("X-Learning-Rate", "0.01"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Iterations", "2"))
                .andExpect(header().string("X-Termination", "CONVERGED"))
                .andExpect(jsonPath("$.algorithmUsed").value("EST"))
                .andExpect(jsonPath("$.pixelSize").value("2x2"))
                .andExpect(jsonPath("$.reconstructionTimeMs").value(250))
                .andExpect(jsonPath("$.trace[1].iteration").value(2))
                .andExpect(jsonPath("$.imageReconstructed[1][0]").value(2.0));
    }

    @Test
    void missingProjectionHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/est/reconstruct")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[16]))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reconstructionService);
    }

    @Test
    void rejectedSignalIsBadRequest() throws Exception {
        when(reconstructionService.reconstruct(any(), eq(3), isNull(), isNull(), isNull(), isNull()))
                .thenThrow(new IllegalArgumentException("Tamanho incorreto do sinal"));

        mockMvc.perform(post("/est/reconstruct")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[10])
                        .header("X-Projections", "3"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Tamanho incorreto do sinal"));
    }
}
