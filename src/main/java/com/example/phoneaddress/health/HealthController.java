package com.example.phoneaddress.health;

import com.example.phoneaddress.access.PhoneAddressAccess;
import com.example.phoneaddress.config.PhoneAddressProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Service")
@Slf4j
public class HealthController {

    private final PhoneAddressAccess access;
    private final String app;

    public HealthController(PhoneAddressAccess access, PhoneAddressProperties properties) {
        this.access = access;
        this.app = properties.projectName();
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Reports whether the service and its Redis store are reachable.")
    public ResponseEntity<Map<String, Object>> health() {
        String redis = redisStatus();
        return ResponseEntity.ok(Map.of(
                "status", "ok".equals(redis) ? "ok" : "degraded",
                "redis", redis,
                "app", app
        ));
    }

    private String redisStatus() {
        try {
            return access.ping() ? "ok" : "unavailable";
        } catch (RuntimeException ex) {
            log.warn("Redis ping failed: {}", ex.getMessage());
            return "unavailable";
        }
    }
}
