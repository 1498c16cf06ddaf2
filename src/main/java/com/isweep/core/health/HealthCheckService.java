package com.isweep.core.health;

import com.isweep.core.preferences.PreferencesStore;
import com.isweep.core.rules.FilterRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final FilterRules filterRules;
    private final PreferencesStore preferencesStore;

    public HealthCheckService(
            @Autowired(required = false) FilterRules filterRules,
            @Autowired(required = false) PreferencesStore preferencesStore) {
        this.filterRules = filterRules;
        this.preferencesStore = preferencesStore;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRules());
        results.add(checkPreferencesStore());
        return results;
    }

    public boolean isHealthy(List<HealthStatus> checks) {
        return checks.stream().allMatch(check -> check.status() == HealthStatus.Status.UP);
    }

    private HealthStatus checkRules() {
        if (filterRules == null) {
            return new HealthStatus("rules", HealthStatus.Status.DOWN,
                    "Filter rules not loaded", Map.of());
        }
        return new HealthStatus("rules", HealthStatus.Status.UP,
                "Filter rules loaded",
                Map.of("source", filterRules.source(),
                        "signals", String.valueOf(filterRules.signalCount())));
    }

    private HealthStatus checkPreferencesStore() {
        if (preferencesStore == null) {
            return new HealthStatus("preferences-store", HealthStatus.Status.DOWN,
                    "No PreferencesStore configured", Map.of());
        }
        String type = preferencesStore.getClass().getSimpleName();
        try {
            if (preferencesStore.isAvailable()) {
                return new HealthStatus("preferences-store", HealthStatus.Status.UP,
                        "PreferencesStore available (" + type + ")", Map.of("type", type));
            }
            return new HealthStatus("preferences-store", HealthStatus.Status.DEGRADED,
                    "PreferencesStore unreachable (" + type + ")", Map.of("type", type));
        } catch (Exception e) {
            log.warn("Preferences store health check failed: {}", e.getMessage());
            return new HealthStatus("preferences-store", HealthStatus.Status.DEGRADED,
                    "PreferencesStore error: " + e.getMessage(), Map.of("type", type));
        }
    }
}
