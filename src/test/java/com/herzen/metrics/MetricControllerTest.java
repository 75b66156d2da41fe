package com.herzen.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class MetricControllerTest {
    @Autowired
    private MockMvc mockMvc;

    private String p;

    @BeforeEach
    void setUp() throws Exception {
        p = UUID.randomUUID().toString().substring(0, 8) + "-";
        mockMvc.perform(post("/api/catalog/items").contentType(MediaType.APPLICATION_JSON).content("""
                        {"items": [
                          {"id": "%1$sl1", "level": "lesson", "parentId": null, "tag": "A"},
                          {"id": "%1$sc1", "level": "component", "parentId": "%1$sl1", "tag": null}
                        ]}
                        """.formatted(p)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.registered").value(2));
    }

    @Test
    void createsMetricFromArrayForms() throws Exception {
        mockMvc.perform(post("/api/metrics").contentType(MediaType.APPLICATION_JSON).content("""
                        {"name": "%1$srest", "level": "lesson", "coverage": ["include", "%1$sl1"],
                         "rule": ["dropNLowest", 1], "multiples": "max", "visibleToStudent": true}
                        """.formatted(p)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").isNotEmpty())
                .andExpect(jsonPath("$.rule[0]").value("dropNLowest"))
                .andExpect(jsonPath("$.rule[1]").value("1"))
                .andExpect(jsonPath("$.coverage[1]").value(p + "l1"))
                .andExpect(jsonPath("$.multiples").value("max"));
    }

    @Test
    void unknownMetricIsNotFound() throws Exception {
        mockMvc.perform(get("/api/metrics/{id}", p + "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("UNKNOWN_METRIC"));
    }

    @Test
    void validationFailuresAreBadRequests() throws Exception {
        mockMvc.perform(post("/api/metrics").contentType(MediaType.APPLICATION_JSON).content("""
                        {"name": "%1$sbad", "level": "lesson", "coverage": ["include", "%1$sghost"], "rule": ["average"]}
                        """.formatted(p)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("UNKNOWN_ITEM"));

        mockMvc.perform(post("/api/metrics").contentType(MediaType.APPLICATION_JSON).content("""
                        {"name": "%1$sbad-level", "level": "chapter", "rule": ["average"]}
                        """.formatted(p)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_DEFINITION"));
    }

    @Test
    void submissionThenComputeThenLearnerView() throws Exception {
        String body = mockMvc.perform(post("/api/metrics").contentType(MediaType.APPLICATION_JSON).content("""
                        {"name": "%1$sflow", "level": "lesson", "coverage": ["include", "%1$sl1"],
                         "rule": ["average"], "visibleToStudent": true}
                        """.formatted(p)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String id = body.replaceAll(".*\"id\":\"([^\"]+)\".*", "$1");

        mockMvc.perform(post("/api/submissions").contentType(MediaType.APPLICATION_JSON).content("""
                        {"learnerId": "%1$su", "itemId": "%1$sc1", "score": 64, "timestamp": 1000}
                        """.formatted(p)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sequence").isNumber());

        mockMvc.perform(post("/api/metrics/{id}/compute", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"learnerIds\": [\"" + p + "u\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scores[0].score").value(64.0));

        mockMvc.perform(get("/api/learners/{learner}/scores", p + "u").param("visibleOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].metricId").value(id))
                .andExpect(jsonPath("$[0].items[0].itemId").value(p + "l1"));

        mockMvc.perform(get("/api/metrics/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.name == 'decayedAverage')]").exists());
    }
}
