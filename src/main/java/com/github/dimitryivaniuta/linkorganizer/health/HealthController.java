package com.github.dimitryivaniuta.linkorganizer.health;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.dimitryivaniuta.linkorganizer.web.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;

/**
 * Liveness endpoints for load balancers and the frontend. {@code /api/health} is excluded from
 * request auditing by the {@code health} skip pattern; {@code /api/ping} is audited.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final Environment environment;
    private final String version;

    public HealthController(Environment environment, @Value("${app.version:1.0.0}") String version) {
        this.environment = environment;
        this.version = version;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HealthStatus(String status, Instant timestamp, String version, String environment, SystemInfo system) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SystemInfo(int availableProcessors, double systemLoadAverage,
                             long heapUsedBytes, long heapMaxBytes, long uptimeMs) {}

    public record Pong(String message, Instant timestamp) {}

    @GetMapping("/health")
    public ApiResponse<HealthStatus> health() {
        Runtime rt = Runtime.getRuntime();
        SystemInfo system = new SystemInfo(
                rt.availableProcessors(),
                ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage(),
                rt.totalMemory() - rt.freeMemory(),
                rt.maxMemory(),
                ManagementFactory.getRuntimeMXBean().getUptime()
        );
        String[] profiles = environment.getActiveProfiles();
        String env = profiles.length == 0 ? "default" : String.join(",", profiles);

        return ApiResponse.ok(new HealthStatus("OK", Instant.now(), version, env, system),
                "Link Organizer API is running");
    }

    @GetMapping("/ping")
    public ApiResponse<Pong> ping() {
        return ApiResponse.ok(new Pong("pong", Instant.now()));
    }
}
