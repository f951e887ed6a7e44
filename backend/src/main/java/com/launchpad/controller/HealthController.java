package com.launchpad.controller;

import com.launchpad.bootstrap.ProcessRole;
import com.launchpad.bootstrap.RuntimeEnvironment;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Liveness endpoint at /api/health, served by both process roles.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final ProcessRole processRole;
    private final RuntimeEnvironment runtimeEnvironment;

    @GetMapping("/health")
    @Operation(summary = "Report process status")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("role", processRole.name().toLowerCase(Locale.ROOT));
        body.put("environment", runtimeEnvironment.getValue());
        return ResponseEntity.ok(body);
    }
}
