package com.provenant.core.health;

import com.provenant.core.keys.KeyHierarchyManager;
import com.provenant.sandbox.SandboxPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ObjectProvider<DataSource> dataSource;
    private final KeyHierarchyManager keyManager;
    private final ObjectProvider<SandboxPool> sandboxPool;

    public HealthCheckService(ObjectProvider<DataSource> dataSource, KeyHierarchyManager keyManager,
                              ObjectProvider<SandboxPool> sandboxPool) {
        this.dataSource = dataSource;
        this.keyManager = keyManager;
        this.sandboxPool = sandboxPool;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkHsm());
        results.add(checkBuilders());
        return results;
    }

    HealthStatus checkDatabase() {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured; audit, keys and suspensions are held in memory", Map.of());
        }
        try (var conn = ds.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkHsm() {
        String name = keyManager.hsmName();
        if (keyManager.isHsmAvailable()) {
            return new HealthStatus("hsm", HealthStatus.Status.UP, "HSM " + name + " available",
                    Map.of("provider", name));
        }
        return new HealthStatus("hsm", HealthStatus.Status.DOWN, "HSM " + name + " unavailable; signing fails closed",
                Map.of("provider", name));
    }

    HealthStatus checkBuilders() {
        SandboxPool pool = sandboxPool.getIfAvailable();
        if (pool == null) {
            return new HealthStatus("builders", HealthStatus.Status.DOWN,
                    "No sandbox pool configured", Map.of());
        }
        Map<String, Boolean> availability;
        try {
            availability = pool.availability();
        } catch (RuntimeException e) {
            log.warn("Builder health check failed: {}", e.getMessage());
            return new HealthStatus("builders", HealthStatus.Status.DOWN,
                    "Builder check error: " + e.getMessage(), Map.of());
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        availability.forEach((id, up) -> metadata.put(id, up ? "UP" : "DOWN"));
        long up = availability.values().stream().filter(Boolean::booleanValue).count();
        if (up == availability.size() && up > 0) {
            return new HealthStatus("builders", HealthStatus.Status.UP,
                    up + " builder node(s) available", metadata);
        }
        if (up == 0) {
            return new HealthStatus("builders", HealthStatus.Status.DOWN,
                    "No builder node available", metadata);
        }
        return new HealthStatus("builders", HealthStatus.Status.DEGRADED,
                up + " of " + availability.size() + " builder node(s) available", metadata);
    }
}
