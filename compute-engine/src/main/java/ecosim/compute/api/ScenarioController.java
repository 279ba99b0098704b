package ecosim.compute.api;

import ecosim.compute.service.ScenarioService;
import ecosim.config.ApiRoutes;
import ecosim.domain.dto.scenario.DuplicateScenarioRequest;
import ecosim.domain.dto.scenario.LikeResponse;
import ecosim.domain.dto.scenario.ScenarioDTO;
import ecosim.domain.dto.scenario.ScenarioDeletedResponse;
import ecosim.domain.dto.scenario.ScenarioPageResponse;
import ecosim.domain.dto.scenario.ScenarioQuery;
import ecosim.domain.dto.scenario.ScenarioRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping(ApiRoutes.SCENARIOS)
@Tag(name = "Escenarios", description = "Catálogo de escenarios guardados")
@RequiredArgsConstructor
public class ScenarioController {

    private static final int POPULAR_LIMIT = 10;

    private final ScenarioService scenarioService;

    // =========================================================================
    // 1. CONSULTAS
    // =========================================================================

    // GET /api/scenarios?public=true&search=stable&sortBy=likes&order=desc&limit=20&page=1
    @GetMapping
    @Operation(summary = "Buscar escenarios con filtros y paginación")
    public ResponseEntity<ScenarioPageResponse> listScenarios(
            @RequestParam(name = "public", required = false) String publicOnly,
            @RequestParam(required = false) String createdBy,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String order,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "1") int page
    ) {
        ScenarioQuery query = ScenarioQuery.builder()
                .publicOnly("true".equals(publicOnly))
                .createdBy(createdBy)
                .search(search)
                .sortBy(sortBy)
                .ascending("asc".equalsIgnoreCase(order))
                .limit(limit)
                .page(page)
                .build();
        return ResponseEntity.ok(scenarioService.search(query));
    }

    @GetMapping("/popular")
    @Operation(summary = "Escenarios públicos más populares")
    public ResponseEntity<List<ScenarioDTO>> popularScenarios() {
        return ResponseEntity.ok(scenarioService.findPopular(POPULAR_LIMIT));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Obtener un escenario (incrementa visitas)")
    public ResponseEntity<ScenarioDTO> getScenario(@PathVariable String id) {
        return ResponseEntity.ok(scenarioService.getScenario(id));
    }

    // =========================================================================
    // 2. GESTIÓN CRUD
    // =========================================================================

    @PostMapping
    @Operation(summary = "Crear escenario")
    public ResponseEntity<ScenarioDTO> createScenario(@RequestBody ScenarioRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scenarioService.createScenario(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Modificar escenario (parcial)")
    public ResponseEntity<ScenarioDTO> updateScenario(@PathVariable String id, @RequestBody ScenarioRequest request) {
        return ResponseEntity.ok(scenarioService.updateScenario(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Eliminar escenario")
    public ResponseEntity<ScenarioDeletedResponse> deleteScenario(@PathVariable String id) {
        scenarioService.deleteScenario(id);
        return ResponseEntity.ok(new ScenarioDeletedResponse("Scenario deleted successfully", id));
    }

    // =========================================================================
    // 3. INTERACCIÓN SOCIAL
    // =========================================================================

    @PostMapping("/{id}/like")
    @Operation(summary = "Dar \"me gusta\" a un escenario")
    public ResponseEntity<LikeResponse> likeScenario(@PathVariable String id) {
        return ResponseEntity.ok(new LikeResponse(scenarioService.likeScenario(id)));
    }

    @PostMapping("/{id}/duplicate")
    @Operation(summary = "Duplicar escenario como copia privada")
    public ResponseEntity<ScenarioDTO> duplicateScenario(
            @PathVariable String id,
            @RequestBody(required = false) DuplicateScenarioRequest request
    ) {
        String createdBy = request != null ? request.createdBy() : null;
        return ResponseEntity.status(HttpStatus.CREATED).body(scenarioService.duplicateScenario(id, createdBy));
    }
}
