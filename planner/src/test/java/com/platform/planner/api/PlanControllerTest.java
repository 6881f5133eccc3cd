package com.platform.planner.api;

import com.platform.planner.error.InvalidMarketException;
import com.platform.planner.error.PlanNotFoundException;
import com.platform.planner.error.SettingsCompilationException;
import com.platform.planner.observability.LoggingConfig;
import com.platform.planner.observability.PlannerMetrics;
import com.platform.planner.plan.PlanService;
import com.platform.planner.plan.PlanState;
import com.platform.planner.settings.SettingTag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlanController.class)
@Import(LoggingConfig.class)
class PlanControllerTest {
    
    @Autowired
    private MockMvc mvc;
    
    @MockBean
    private PlanService planService;
    
    @MockBean
    private PlannerMetrics metrics;
    
    @Test
    void submitIsAccepted() throws Exception {
        when(planService.submit(any())).thenReturn(PlanStatus.builder()
            .id("p-1").scenarioName("capacity").planState(PlanState.NEW).build());
        
        mvc.perform(post("/api/plans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"capacity\",\"scope\":[\"cluster-1\"],\"version\":\"6.1.0\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.id").value("p-1"))
            .andExpect(jsonPath("$.planState").value("NEW"))
            .andExpect(jsonPath("$.errorCode").doesNotExist());
    }
    
    @Test
    void invalidRequestIsRejectedBeforeSubmission() throws Exception {
        mvc.perform(post("/api/plans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"capacity\",\"entities\":[{\"targets\":[]}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("PL-100"))
            .andExpect(jsonPath("$.fieldErrors").isArray());
        
        verifyNoInteractions(planService);
    }
    
    @Test
    void unreadableBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/plans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"NOT_A_TYPE\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("PL-103"));
    }
    
    @Test
    void compilationFailureIsUnprocessable() throws Exception {
        when(planService.preview(any())).thenThrow(SettingsCompilationException.notMapped(SettingTag.RELIEVE_PRESSURE, "5.9.0"));
        
        mvc.perform(post("/api/plans/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"capacity\",\"version\":\"5.9.0\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("PL-202"))
            .andExpect(jsonPath("$.metadata.setting").value("RELIEVE_PRESSURE"));
    }
    
    @Test
    void unknownPlanIsNotFound() throws Exception {
        when(planService.get("missing")).thenThrow(new PlanNotFoundException("missing"));
        
        mvc.perform(get("/api/plans/missing").header("X-Correlation-ID", "trace-1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("PL-407"))
            .andExpect(jsonPath("$.traceId").value("trace-1"));
    }
    
    @Test
    void protectedMarketCannotBeDeleted() throws Exception {
        when(planService.delete(eq("p-1"), eq(true))).thenThrow(InvalidMarketException.protectedMarket("Market"));
        
        mvc.perform(delete("/api/plans/p-1").param("keepScenario", "true"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("PL-500"))
            .andExpect(jsonPath("$.metadata.market").value("Market"));
        
        verify(planService).delete("p-1", true);
    }
}
