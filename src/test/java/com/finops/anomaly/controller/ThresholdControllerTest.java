package com.finops.anomaly.controller;

import com.finops.anomaly.config.AnomalyProperties;
import com.finops.anomaly.service.ThresholdRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ThresholdController.class)
@Import({ThresholdRegistry.class, AnomalyProperties.class})
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class ThresholdControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ThresholdRegistry registry;

    @Test
    void getThresholds_listsKnownMetrics() throws Exception {
        mockMvc.perform(get("/anomaly/thresholds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cost_per_post.baseline").value(0.02))
                .andExpect(jsonPath("$.cost_per_post.warning_pct").value(0.25))
                .andExpect(jsonPath("$.viral_coefficient.warning_pct").value(0.7))
                .andExpect(jsonPath("$.pattern_fatigue.warning_pct").value(0.8))
                .andExpect(jsonPath("$.engagement_rate.window_size").value(100));
    }

    @Test
    void putNested_updatesOnlyNamedFields() throws Exception {
        mockMvc.perform(put("/anomaly/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cost_per_post\": {\"baseline\": 0.03, \"window_size\": 50}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cost_per_post.baseline").value(0.03))
                .andExpect(jsonPath("$.cost_per_post.window_size").value(50))
                .andExpect(jsonPath("$.cost_per_post.warning_pct").value(0.25));

        assertThat(registry.get("cost_per_post").getBaseline()).isEqualTo(0.03);
    }

    @Test
    void putFlatKeys_mapToMetricFields() throws Exception {
        mockMvc.perform(put("/anomaly/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cost_baseline\": 0.025, \"viral_drop_threshold\": 0.6, \"fatigue_threshold\": 0.85}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cost_per_post.baseline").value(0.025))
                .andExpect(jsonPath("$.viral_coefficient.warning_pct").value(0.6))
                .andExpect(jsonPath("$.pattern_fatigue.warning_pct").value(0.85));
    }

    @Test
    void putFlatKeys_crossingCriticalTier_moveTierWithWarning() throws Exception {
        mockMvc.perform(put("/anomaly/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cost_threshold\": 0.6, \"viral_drop_threshold\": 0.4, \"fatigue_threshold\": 0.95}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cost_per_post.warning_pct").value(0.6))
                .andExpect(jsonPath("$.cost_per_post.elevated_multiplier").value(1.6))
                .andExpect(jsonPath("$.cost_per_post.critical_multiplier").value(2.0))
                .andExpect(jsonPath("$.viral_coefficient.warning_pct").value(0.4))
                .andExpect(jsonPath("$.viral_coefficient.critical_pct").value(0.4))
                .andExpect(jsonPath("$.pattern_fatigue.warning_pct").value(0.95))
                .andExpect(jsonPath("$.pattern_fatigue.critical_pct").value(0.95));
    }

    @Test
    void putFlatKey_withExplicitTier_keepsRequestedTier() throws Exception {
        mockMvc.perform(put("/anomaly/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fatigue_threshold\": 0.95, \"pattern_fatigue\": {\"critical_pct\": 0.92}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("critical_pct"));

        assertThat(registry.get("pattern_fatigue").getCriticalPct()).isEqualTo(0.9);
    }

    @Test
    void putThenGet_returnsSameThresholds() throws Exception {
        MvcResult updated = mockMvc.perform(put("/anomaly/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"engagement_rate\": {\"baseline\": 0.07, \"outlier_z_score\": 3.0}, "
                                + "\"viral_baseline\": 1.2}"))
                .andExpect(status().isOk())
                .andReturn();

        MvcResult fetched = mockMvc.perform(get("/anomaly/thresholds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.engagement_rate.baseline").value(0.07))
                .andExpect(jsonPath("$.engagement_rate.outlier_z_score").value(3.0))
                .andExpect(jsonPath("$.viral_coefficient.baseline").value(1.2))
                .andReturn();

        assertThat(fetched.getResponse().getContentAsString())
                .isEqualTo(updated.getResponse().getContentAsString());
    }

    @Test
    void putInvalidValue_rejectsWholeUpdate() throws Exception {
        mockMvc.perform(put("/anomaly/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cost_baseline\": 0.03, \"viral_coefficient\": {\"warning_pct\": 1.5}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("warning_pct"));

        assertThat(registry.get("cost_per_post").getBaseline()).isEqualTo(0.02);
        assertThat(registry.get("viral_coefficient").getWarningPct()).isEqualTo(0.7);
    }

    @Test
    void putUnknownKey_returns400() throws Exception {
        mockMvc.perform(put("/anomaly/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cost_ceiling\": 0.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("cost_ceiling"));
    }

    @Test
    void putEmptyBody_returns400() throws Exception {
        mockMvc.perform(put("/anomaly/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("body"));
    }
}
