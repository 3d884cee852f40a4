package com.network.matching.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and combines them: the aggregate takes the worst status,
 * with the message of the first check reporting it. Each check's result is kept as a detail
 * under the check's name.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus worst = HealthStatus.up();
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = check.check();
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstMessage = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst.status(), worstMessage, results);
    }

    public int size() {
        return checks.size();
    }
}
