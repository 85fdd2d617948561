package com.crewdesk.core.health;

import com.crewdesk.backend.ExecutionBackend;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.skills.SkillRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SkillRegistry skillRegistry;
    private final ExecutionBackend backend;
    private final CrewdeskProperties properties;

    public HealthCheckService(
            @Autowired(required = false) SkillRegistry skillRegistry,
            @Autowired(required = false) ExecutionBackend backend,
            CrewdeskProperties properties) {
        this.skillRegistry = skillRegistry;
        this.backend = backend;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSkills());
        results.add(checkStorage());
        results.add(checkBackend());
        return results;
    }

    private HealthStatus checkSkills() {
        if (skillRegistry == null) {
            return new HealthStatus("skills", HealthStatus.Status.DOWN,
                    "No SkillRegistry configured", Map.of());
        }
        int count = skillRegistry.getAllSkills().size();
        if (count == 0) {
            return new HealthStatus("skills", HealthStatus.Status.DEGRADED,
                    "No skills indexed; tasks will run with a generalist", Map.of("skills", "0"));
        }
        return new HealthStatus("skills", HealthStatus.Status.UP,
                count + " skill(s) indexed", Map.of("skills", String.valueOf(count)));
    }

    private HealthStatus checkStorage() {
        Path home = properties.homePath();
        try {
            Files.createDirectories(home);
            if (Files.isWritable(home)) {
                return new HealthStatus("storage", HealthStatus.Status.UP,
                        "Home directory writable", Map.of("path", home.toString()));
            }
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Home directory not writable", Map.of("path", home.toString()));
        } catch (Exception e) {
            log.warn("Storage health check failed: {}", e.getMessage());
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Storage error: " + e.getMessage(), Map.of("path", home.toString()));
        }
    }

    private HealthStatus checkBackend() {
        if (backend == null) {
            return new HealthStatus("backend", HealthStatus.Status.DOWN,
                    "No ExecutionBackend configured", Map.of());
        }
        try {
            if (backend.isAvailable()) {
                return new HealthStatus("backend", HealthStatus.Status.UP,
                        "Backend available (" + backend.name() + ")", Map.of());
            }
            return new HealthStatus("backend", HealthStatus.Status.DOWN,
                    "Backend not found (" + backend.name() + ")", Map.of());
        } catch (Exception e) {
            log.warn("Backend health check failed: {}", e.getMessage());
            return new HealthStatus("backend", HealthStatus.Status.DOWN,
                    "Backend error: " + e.getMessage(), Map.of());
        }
    }
}
