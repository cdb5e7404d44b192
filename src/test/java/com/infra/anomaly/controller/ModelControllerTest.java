package com.infra.anomaly.controller;

import com.infra.anomaly.exception.ModelVersionNotFoundException;
import com.infra.anomaly.model.CycleOutcome;
import com.infra.anomaly.model.CycleResult;
import com.infra.anomaly.model.ModelStatus;
import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.model.RetrainTrigger;
import com.infra.anomaly.registry.ModelVersionStore;
import com.infra.anomaly.service.RetrainOrchestrator;
import com.infra.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    private static ModelVersion active;
    private static ModelVersion retired;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelVersionStore store;

    @MockBean
    private RetrainOrchestrator orchestrator;

    @BeforeAll
    static void models() {
        active = TestDataFactory.activeModel("v20251019_104000_2", 2);
        retired = active.toBuilder().id("v20251019_103000_1").sequence(1).status(ModelStatus.RETIRED).build();
    }

    @Test
    void listVersions_returnsSummariesWithoutArtifacts() throws Exception {
        when(store.list()).thenReturn(List.of(retired, active));

        mockMvc.perform(get("/api/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].id").value("v20251019_104000_2"))
                .andExpect(jsonPath("$[1].status").value("ACTIVE"))
                .andExpect(jsonPath("$[1].treeCount").value(50))
                .andExpect(jsonPath("$[1].featureCount").value(3))
                .andExpect(jsonPath("$[1].forest").doesNotExist());
    }

    @Test
    void getActive_found() throws Exception {
        when(store.getActive()).thenReturn(active);

        mockMvc.perform(get("/api/v1/models/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("v20251019_104000_2"))
                .andExpect(jsonPath("$.hyperparameters.contamination").value(0.02));
    }

    @Test
    void getActive_noModelYet_notFound() throws Exception {
        when(store.getActive()).thenReturn(null);

        mockMvc.perform(get("/api/v1/models/active"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getVersion_notFound() throws Exception {
        when(store.find("v_missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/models/v_missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void retrain_returnsCycleOutcome() throws Exception {
        when(orchestrator.retrainNow()).thenReturn(CycleOutcome.builder()
                .cycleId(4)
                .trigger(RetrainTrigger.MANUAL)
                .result(CycleResult.REJECTED)
                .candidateVersionId("v20251019_105000_3")
                .activeVersionId("v20251019_104000_2")
                .reason("candidate F1 0.4000 < incumbent F1 0.9000 - tolerance 0.02")
                .build());

        mockMvc.perform(post("/api/v1/models/retrain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trigger").value("MANUAL"))
                .andExpect(jsonPath("$.result").value("REJECTED"))
                .andExpect(jsonPath("$.activeVersionId").value("v20251019_104000_2"));
    }

    @Test
    void rollback_success() throws Exception {
        when(store.rollback("v20251019_103000_1")).thenReturn(retired.withStatus(ModelStatus.ACTIVE));

        mockMvc.perform(post("/api/v1/models/v20251019_103000_1/rollback"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("v20251019_103000_1"))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void rollback_unknownVersion_notFound() throws Exception {
        when(store.rollback("v_missing")).thenThrow(new ModelVersionNotFoundException("v_missing"));

        mockMvc.perform(post("/api/v1/models/v_missing/rollback"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Model version not found: v_missing"));
    }
}
