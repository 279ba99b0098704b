package ecosim.compute.api;

import ecosim.compute.service.SimulationService;
import ecosim.compute.service.SimulationStreamService;
import ecosim.config.ApiRoutes;
import ecosim.domain.dto.simulation.PhaseSpaceRequest;
import ecosim.domain.dto.simulation.PhaseSpaceResponse;
import ecosim.domain.dto.simulation.PredictionRequest;
import ecosim.domain.dto.simulation.PredictionResponse;
import ecosim.domain.dto.simulation.SimulationPreset;
import ecosim.domain.dto.simulation.SimulationRunRequest;
import ecosim.domain.dto.simulation.SimulationRunResponse;
import ecosim.domain.dto.simulation.StreamRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

@RestController
@RequestMapping(ApiRoutes.SIMULATION)
@Tag(name = "Simulación", description = "Ejecución, streaming y análisis del modelo depredador-presa")
@RequiredArgsConstructor
@Slf4j
public class SimulationController {

    private final SimulationService simulationService;
    private final SimulationStreamService streamService;

    @PostMapping("/run")
    @Operation(summary = "Ejecutar una simulación completa")
    public ResponseEntity<SimulationRunResponse> runSimulation(@RequestBody SimulationRunRequest request) {
        log.info(">>> API: Recibida petición de simulación (guardar: {}, escenario: {})",
                request.saveResults(), request.scenarioId());
        return ResponseEntity.ok(simulationService.runSimulation(request));
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Simulación en streaming (SSE)", description = "Emite eventos update por lote y un evento complete final.")
    public SseEmitter streamSimulation(@RequestBody StreamRequest request) {
        return streamService.startStream(request.parameters(), request.updateInterval());
    }

    @PostMapping("/predict")
    @Operation(summary = "Estimación analítica del equilibrio")
    public ResponseEntity<PredictionResponse> predictEquilibrium(@RequestBody PredictionRequest request) {
        return ResponseEntity.ok(simulationService.predictEquilibrium(request.parameters()));
    }

    @PostMapping("/phase-space")
    @Operation(summary = "Muestrear el campo vectorial del plano de fases")
    public ResponseEntity<PhaseSpaceResponse> phaseSpace(@RequestBody PhaseSpaceRequest request) {
        return ResponseEntity.ok(simulationService.samplePhaseSpace(request.parameters(), request.resolution()));
    }

    @GetMapping("/presets")
    @Operation(summary = "Listar escenarios predefinidos")
    public ResponseEntity<List<SimulationPreset>> presets() {
        return ResponseEntity.ok(simulationService.getPresets());
    }
}
