package com.finops.anomaly.controller;

import com.finops.anomaly.exception.ValidationException;
import com.finops.anomaly.service.AnomalyDetectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService detectionService;

    @Test
    void stats_returnsPerKindDiagnostics() throws Exception {
        when(detectionService.modelStats()).thenReturn(Map.of(
                "statistical", Map.of("cost_per_post", Map.of("count", 12, "mean", 0.021)),
                "fatigue", Map.of()));

        mockMvc.perform(get("/anomaly/models/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statistical.cost_per_post.count").value(12))
                .andExpect(jsonPath("$.fatigue").isEmpty());
    }

    @Test
    void reset_listOfKinds() throws Exception {
        when(detectionService.resetModels(List.of("statistical", "fatigue"))).thenReturn(3);

        mockMvc.perform(post("/anomaly/models/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"models\": [\"statistical\", \"fatigue\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("reset"))
                .andExpect(jsonPath("$.models[1]").value("fatigue"))
                .andExpect(jsonPath("$.keys_cleared").value(3));
    }

    @Test
    void reset_singleKindAsString() throws Exception {
        when(detectionService.resetModels(List.of("all"))).thenReturn(5);

        mockMvc.perform(post("/anomaly/models/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"models\": \"all\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.keys_cleared").value(5));
    }

    @Test
    void reset_unknownKind_returns400() throws Exception {
        when(detectionService.resetModels(anyList()))
                .thenThrow(new ValidationException("Unknown model kind: neural", "models"));

        mockMvc.perform(post("/anomaly/models/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"models\": [\"neural\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("models"));
    }

    @Test
    void reset_missingModels_returns400() throws Exception {
        mockMvc.perform(post("/anomaly/models/reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("models"));

        verifyNoInteractions(detectionService);
    }
}
