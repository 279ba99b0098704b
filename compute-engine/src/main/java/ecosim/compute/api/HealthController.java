package ecosim.compute.api;

import ecosim.config.ApiRoutes;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {

    @GetMapping(ApiRoutes.HEALTH)
    public Map<String, Object> health() {
        return Map.of(
                "status", "healthy",
                "timestamp", Instant.now(),
                "database", "in-memory");
    }
}
