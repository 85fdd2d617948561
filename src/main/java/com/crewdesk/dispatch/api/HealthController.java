package com.crewdesk.dispatch.api;

import com.crewdesk.core.health.HealthCheckService;
import com.crewdesk.core.health.HealthMonitor;
import com.crewdesk.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;
    private final HealthMonitor healthMonitor;

    public HealthController(HealthCheckService healthCheckService, HealthMonitor healthMonitor) {
        this.healthCheckService = healthCheckService;
        this.healthMonitor = healthMonitor;
    }

    /**
     * GET /api/v1/health: component checks plus tasks currently flagged stuck.
     * Returns 200 unless a component is DOWN, then 503.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        boolean anyDown = false;
        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : healthCheckService.checkAll()) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);
            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);
        result.put("stuckTasks", healthMonitor.getStuckTasks());

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
