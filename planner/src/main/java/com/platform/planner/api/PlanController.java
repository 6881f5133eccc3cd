package com.platform.planner.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.planner.plan.PlanService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for submitting and supervising plans.
 */
@RestController
@RequestMapping("/api/plans")
@RequiredArgsConstructor
public class PlanController {
    
    private final PlanService planService;
    
    /**
     * Submit a plan. The plan runs in the background; poll its status.
     */
    @PostMapping
    public ResponseEntity<PlanStatus> submit(@Valid @RequestBody PlanRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(planService.submit(request));
    }
    
    /**
     * Compile a plan request to the wire document without running it.
     */
    @PostMapping(value = "/preview", produces = MediaType.APPLICATION_JSON_VALUE)
    public String preview(@Valid @RequestBody PlanRequest request) {
        return planService.preview(request);
    }
    
    @GetMapping
    public List<PlanStatus> list() {
        return planService.list();
    }
    
    @GetMapping("/{id}")
    public PlanStatus get(@PathVariable String id) {
        return planService.get(id);
    }
    
    @GetMapping("/{id}/stats")
    public JsonNode stats(@PathVariable String id) {
        return planService.stats(id);
    }
    
    @PostMapping("/{id}/stop")
    public PlanStatus stop(@PathVariable String id) {
        return planService.stop(id);
    }
    
    @DeleteMapping("/{id}")
    public PlanStatus delete(@PathVariable String id,
                             @RequestParam(defaultValue = "false") boolean keepScenario) {
        return planService.delete(id, keepScenario);
    }
}
