package com.isweep.dispatch.api;

import com.isweep.core.health.HealthCheckService;
import com.isweep.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for client liveness checks.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    static final String SERVICE_NAME = "ISweep Backend";
    static final String VERSION = "1.0.0";

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/health: Always 200 while the process is up, so clients can
     * tell "backend reachable" from "backend gone". Component problems show
     * up as {@code degraded}.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        List<HealthStatus> checks = healthCheckService != null ? healthCheckService.checkAll() : List.of();
        boolean healthy = healthCheckService != null && healthCheckService.isHealthy(checks);

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);
        }

        result.put("status", healthy ? "healthy" : "degraded");
        result.put("service", SERVICE_NAME);
        result.put("version", VERSION);
        result.put("components", components);
        return ResponseEntity.ok(result);
    }
}
