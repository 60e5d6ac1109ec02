package guraa.stampdetect.controller;

import guraa.stampdetect.service.StampDetectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Controller for health and status checks.
 */
@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final StampDetectionService detectionService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> status = new HashMap<>();
        try {
            status.put("status", "UP");
            status.put("stampCount", detectionService.currentStore().size());

            Map<String, Object> runtime = new HashMap<>();
            runtime.put("maxMemory", Runtime.getRuntime().maxMemory() / (1024 * 1024) + " MB");
            runtime.put("freeMemory", Runtime.getRuntime().freeMemory() / (1024 * 1024) + " MB");
            runtime.put("processors", Runtime.getRuntime().availableProcessors());
            status.put("runtime", runtime);

            return ResponseEntity.ok(status);
        } catch (Exception e) {
            log.error("Error getting health status", e);

            status.put("status", "ERROR");
            status.put("error", e.getMessage());
            return ResponseEntity.internalServerError().body(status);
        }
    }
}
