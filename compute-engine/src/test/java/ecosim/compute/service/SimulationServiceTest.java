package ecosim.compute.service;

import ecosim.config.SimulationParameters;
import ecosim.config.SimulationPresets;
import ecosim.domain.dto.simulation.PhaseSpaceResponse;
import ecosim.domain.dto.simulation.PredictionResponse;
import ecosim.domain.dto.simulation.SimulationRunRequest;
import ecosim.domain.dto.simulation.SimulationRunResponse;
import ecosim.domain.exception.InvalidParametersException;
import ecosim.domain.exception.NumericDegeneracyException;
import ecosim.domain.simulation.SimulationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SimulationServiceTest {

    @Mock
    private ScenarioService scenarioService;

    @Mock
    private SimulationBroadcaster broadcaster;

    private SimulationService simulationService;

    @BeforeEach
    void setUp() {
        simulationService = new SimulationService(new SimulatorFactory(), scenarioService, broadcaster);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Ejecución: devuelve resultado y estadísticas y difunde una vista previa de 10 registros")
    void runSimulation_shouldReturnResultAndBroadcastPreview() {
        SimulationParameters params = SimulationPresets.resourceScarcity();

        SimulationRunResponse response = simulationService.runSimulation(new SimulationRunRequest(params, false, null));

        assertTrue(response.success());
        assertEquals(response.results().getTimestepCount(), response.statistics().totalTimeSteps());
        assertEquals(response.results().summary().duration(), response.statistics().simulationDuration());
        assertTrue(response.statistics().extinctionOccurred());

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster).broadcast(eq(SimulationBroadcaster.SIMULATION_COMPLETE), payload.capture());
        Map<String, Object> message = (Map<String, Object>) payload.getValue();
        assertEquals(params, message.get("parameters"));
        assertEquals(SimulationService.PREVIEW_SIZE, ((SimulationResult) message.get("results")).getTimestepCount());

        verifyNoInteractions(scenarioService);
    }

    @Test
    @DisplayName("Persistencia: con saveResults y scenarioId se adjunta el resultado")
    void runSimulation_withSaveResults_shouldAttachToScenario() {
        SimulationRunResponse response = simulationService.runSimulation(
                new SimulationRunRequest(SimulationPresets.predatorDominant(), true, "7"));

        verify(scenarioService).attachResults("7", response.results());
    }

    @Test
    @DisplayName("Persistencia: saveResults sin scenarioId no guarda nada")
    void runSimulation_withoutScenarioId_shouldNotPersist() {
        simulationService.runSimulation(new SimulationRunRequest(SimulationPresets.predatorDominant(), true, null));

        verify(scenarioService, never()).attachResults(anyString(), any());
    }

    @Test
    @DisplayName("Errores: parámetros inválidos no llegan al motor ni se difunden")
    void runSimulation_invalidParameters_shouldThrowBeforeBroadcasting() {
        assertThrows(InvalidParametersException.class,
                () -> simulationService.runSimulation(new SimulationRunRequest(null, false, null)));

        verifyNoInteractions(broadcaster);
    }

    @Test
    @DisplayName("Predicción: confianza 0.8 si es estable, 0.3 si no")
    void predictEquilibrium_shouldAttachConfidence() {
        PredictionResponse stable = simulationService.predictEquilibrium(SimulationPresets.balancedEcosystem());
        PredictionResponse unstable = simulationService.predictEquilibrium(
                SimulationPresets.of(1000, 1.0, 5000, 100, 0.01, 0.5, 0.0, false, 0.2));

        assertEquals(0.8, stable.confidence());
        assertTrue(stable.explanation().contains("stable equilibrium"));
        assertEquals(0.3, unstable.confidence());
        assertFalse(unstable.prediction().stable());
    }

    @Test
    @DisplayName("Predicción: eficiencia de caza 0 es una degeneración numérica")
    void predictEquilibrium_zeroHunting_shouldThrow() {
        SimulationParameters params = SimulationPresets.balancedEcosystem();

        assertThrows(NumericDegeneracyException.class, () -> simulationService.predictEquilibrium(
                params.withPredator(params.predator().withHuntingEfficiency(0.0))));
    }

    @Test
    @DisplayName("Plano de fases: resolución por defecto 15 y límites de la rejilla")
    void samplePhaseSpace_shouldDefaultResolution() {
        PhaseSpaceResponse response = simulationService.samplePhaseSpace(SimulationPresets.balancedEcosystem(), null);

        assertEquals(15, response.resolution());
        assertEquals(225, response.phaseSpace().size());
        assertEquals(5000.0, response.bounds().preyMax());
        assertEquals(1000.0, response.bounds().predatorMax());
        assertEquals(16, simulationService.samplePhaseSpace(SimulationPresets.balancedEcosystem(), 4).phaseSpace().size());
    }

    @Test
    @DisplayName("Presets: cuatro escenarios con nombre y parámetros")
    void getPresets_shouldReturnCatalog() {
        assertEquals(4, simulationService.getPresets().size());
        assertEquals(SimulationPresets.BALANCED_ECOSYSTEM, simulationService.getPresets().get(0).name());
    }
}
