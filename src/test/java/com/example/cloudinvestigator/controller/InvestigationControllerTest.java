package com.example.cloudinvestigator.controller;

import com.example.cloudinvestigator.domain.Provider;
import com.example.cloudinvestigator.planner.PlannedStep;
import com.example.cloudinvestigator.planner.Planner;
import com.example.cloudinvestigator.planner.PlannerException;
import com.example.cloudinvestigator.query.QueryExecutor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class InvestigationControllerTest {

    private static final String BUCKETS_REQUEST = "{\"prompt\":\"List S3 buckets\",\"provider\":\"aws\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private Planner planner;

    @MockBean
    private QueryExecutor queryExecutor;

    @Test
    void runsInvestigation() throws Exception {
        when(planner.generatePlan(anyString(), eq(Provider.AWS), anySet(), any()))
                .thenReturn(List.of(new PlannedStep("list buckets", "SELECT name FROM aws_s3_bucket")));
        when(queryExecutor.execute(eq(Provider.AWS), anyString(), any(), anyString(), any()))
                .thenReturn("[{\"name\":\"logs\"},{\"name\":\"assets\"}]");

        mockMvc.perform(post("/api/investigations").contentType(MediaType.APPLICATION_JSON).content(BUCKETS_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.queryCount").value(1))
                .andExpect(jsonPath("$.steps[0].results.length()").value(2))
                .andExpect(jsonPath("$.insights[0].type").value("result"));
    }

    @Test
    void blankPromptIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/investigations").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\" \",\"provider\":\"aws\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void unknownProviderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/investigations").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"List VMs\",\"provider\":\"oracle\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void plannerFailureIsBadGateway() throws Exception {
        when(planner.generatePlan(anyString(), any(), anySet(), any()))
                .thenThrow(new PlannerException("LLM API returned 401"));

        mockMvc.perform(post("/api/investigations").contentType(MediaType.APPLICATION_JSON).content(BUCKETS_REQUEST))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("PLANNER_FAILED"))
                .andExpect(jsonPath("$.details").value("LLM API returned 401"));
    }

    @Test
    void cancellingUnknownInvestigationIsNotFound() throws Exception {
        mockMvc.perform(delete("/api/investigations/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void listsTools() throws Exception {
        mockMvc.perform(get("/api/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("steampipe_query"));
    }

    @Test
    void toolCallReturnsEnvelope() throws Exception {
        when(queryExecutor.execute(eq(Provider.AWS), anyString(), any(), anyString(), any()))
                .thenReturn("[{\"instance_id\":\"i-1\"}]");

        mockMvc.perform(post("/api/tools/steampipe_query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"aws\",\"query\":\"SELECT instance_id FROM aws_ec2_instance\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.row_count").value(1));
    }

    @Test
    void toolCallWithBadProviderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/tools/steampipe_query").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"oracle\",\"query\":\"SELECT 1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void unknownToolIsNotFound() throws Exception {
        mockMvc.perform(post("/api/tools/kubectl").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void memoryStatsAreExposed() throws Exception {
        mockMvc.perform(get("/api/investigations/memory"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recent_lessons").isArray())
                .andExpect(jsonPath("$.top_patterns").isArray());
    }
}
