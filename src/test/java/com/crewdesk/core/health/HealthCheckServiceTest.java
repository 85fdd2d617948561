package com.crewdesk.core.health;

import com.crewdesk.backend.ExecutionBackend;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.skills.SkillEntry;
import com.crewdesk.skills.SkillRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private CrewdeskProperties properties;
    private SkillRegistry skills;
    private ExecutionBackend backend;

    @BeforeEach
    void setUp() {
        properties = new CrewdeskProperties();
        properties.setHome(tempDir.resolve("home").toString());
        skills = mock(SkillRegistry.class);
        backend = mock(ExecutionBackend.class);
        when(backend.name()).thenReturn("cli");
    }

    private Map<String, HealthStatus> byComponent(HealthCheckService service) {
        return service.checkAll().stream()
                .collect(Collectors.toMap(HealthStatus::component, Function.identity()));
    }

    @Test
    @DisplayName("all components UP with skills, a writable home and an available backend")
    void allUp() {
        when(skills.getAllSkills()).thenReturn(List.of(
                SkillEntry.of("marketing", "copywriting", "Writes copy"),
                SkillEntry.of("legal", "contract-review", "Reviews contracts")));
        when(backend.isAvailable()).thenReturn(true);

        Map<String, HealthStatus> results = byComponent(new HealthCheckService(skills, backend, properties));

        assertEquals(3, results.size());
        assertEquals(HealthStatus.Status.UP, results.get("skills").status());
        assertEquals("2", results.get("skills").metadata().get("skills"));
        assertEquals(HealthStatus.Status.UP, results.get("storage").status());
        assertTrue(Files.isDirectory(tempDir.resolve("home")));
        assertEquals(HealthStatus.Status.UP, results.get("backend").status());
        assertTrue(results.get("backend").detail().contains("cli"));
    }

    @Test
    @DisplayName("an empty skill index is DEGRADED, not DOWN")
    void noSkills() {
        when(skills.getAllSkills()).thenReturn(List.of());

        HealthStatus status = byComponent(new HealthCheckService(skills, backend, properties)).get("skills");

        assertEquals(HealthStatus.Status.DEGRADED, status.status());
    }

    @Test
    @DisplayName("a missing backend executable is DOWN")
    void backendMissing() {
        when(backend.isAvailable()).thenReturn(false);

        HealthStatus status = byComponent(new HealthCheckService(skills, backend, properties)).get("backend");

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("not found"));
    }

    @Test
    @DisplayName("a backend probe that throws is reported DOWN")
    void backendThrows() {
        when(backend.isAvailable()).thenThrow(new IllegalStateException("probe failed"));

        HealthStatus status = byComponent(new HealthCheckService(skills, backend, properties)).get("backend");

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("probe failed"));
    }

    @Test
    @DisplayName("a home path that cannot be created is DOWN")
    void storageUnavailable() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        properties.setHome(blocker.resolve("home").toString());

        HealthStatus status = byComponent(new HealthCheckService(skills, backend, properties)).get("storage");

        assertEquals(HealthStatus.Status.DOWN, status.status());
    }

    @Test
    @DisplayName("missing collaborators are DOWN instead of failing the check")
    void missingCollaborators() {
        Map<String, HealthStatus> results = byComponent(new HealthCheckService(null, null, properties));

        assertEquals(HealthStatus.Status.DOWN, results.get("skills").status());
        assertEquals(HealthStatus.Status.DOWN, results.get("backend").status());
        assertEquals(HealthStatus.Status.UP, results.get("storage").status());
    }
}
