package ecosim.compute.api;

import ecosim.compute.service.SimulationService;
import ecosim.compute.service.SimulationStreamService;
import ecosim.config.ApiRoutes;
import ecosim.config.SimulationPresets;
import ecosim.domain.analysis.EquilibriumPrediction;
import ecosim.domain.analysis.PhaseSpacePoint;
import ecosim.domain.dto.simulation.PhaseSpaceResponse;
import ecosim.domain.dto.simulation.PredictionResponse;
import ecosim.domain.dto.simulation.SimulationRunResponse;
import ecosim.domain.dto.simulation.SimulationStatistics;
import ecosim.domain.exception.InvalidParametersException;
import ecosim.domain.exception.NumericDegeneracyException;
import ecosim.domain.simulation.SimulationResult;
import ecosim.physics.simulator.EcosystemSimulator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = SimulationController.class)
class SimulationControllerTest {

    private static final String BALANCED_JSON = """
            {
              "parameters": {
                "prey": { "initialPopulation": 1000, "birthRate": 1.0, "carryingCapacity": 5000 },
                "predator": { "initialPopulation": 100, "huntingEfficiency": 0.01, "deathRate": 0.5 },
                "environment": { "resourceAvailability": 0.7, "seasonalVariation": false, "seasonalAmplitude": 0.2 }
              }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SimulationService simulationService;

    @MockBean
    private SimulationStreamService streamService;

    // --- TEST 1: EJECUCIÓN COMPLETA ---
    @Test
    void runSimulation_ShouldReturn200_WithResultsAndStatistics() throws Exception {
        // A. GIVEN
        SimulationResult result = new EcosystemSimulator(SimulationPresets.balancedEcosystem()).runFullSimulation();
        var response = new SimulationRunResponse(true, result, new SimulationStatistics(
                result.getTimestepCount(), result.summary().duration(), false, true));

        given(simulationService.runSimulation(any())).willReturn(response);

        // B. WHEN & THEN
        mockMvc.perform(post(ApiRoutes.SIMULATION + "/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BALANCED_JSON))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.statistics.totalTimeSteps").value(result.getTimestepCount()))
                .andExpect(jsonPath("$.statistics.extinctionOccurred").value(true))
                .andExpect(jsonPath("$.results.timeSteps[0].preyPopulation").exists())
                .andExpect(jsonPath("$.results.equilibriumPoint").doesNotExist())
                .andExpect(jsonPath("$.results.summary.duration").exists())
                .andExpect(jsonPath("$.results.timestepCount").doesNotExist());
    }

    // --- TEST 2: ERRORES DE PARÁMETROS ---
    @Test
    void runSimulation_ShouldReturn400_WhenParametersAreInvalid() throws Exception {
        given(simulationService.runSimulation(any()))
                .willThrow(new InvalidParametersException("Parameters required"));

        mockMvc.perform(post(ApiRoutes.SIMULATION + "/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Parameters required"));
    }

    @Test
    void runSimulation_ShouldReturn400_WhenBodyIsMalformed() throws Exception {
        mockMvc.perform(post(ApiRoutes.SIMULATION + "/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    // --- TEST 3: PREDICCIÓN ---
    @Test
    void predict_ShouldReturnPredictionWithConfidence() throws Exception {
        var prediction = new PredictionResponse(new EquilibriumPrediction(100.0, 70.0, true), 0.8,
                "The system is likely to reach a stable equilibrium with these parameters.");
        given(simulationService.predictEquilibrium(any())).willReturn(prediction);

        mockMvc.perform(post(ApiRoutes.SIMULATION + "/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BALANCED_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prediction.prey").value(100.0))
                .andExpect(jsonPath("$.prediction.predator").value(70.0))
                .andExpect(jsonPath("$.prediction.isStable").value(true))
                .andExpect(jsonPath("$.confidence").value(0.8));
    }

    @Test
    void predict_ShouldReturn422_WhenHuntingEfficiencyIsZero() throws Exception {
        given(simulationService.predictEquilibrium(any()))
                .willThrow(new NumericDegeneracyException("predator.huntingEfficiency is zero"));

        mockMvc.perform(post(ApiRoutes.SIMULATION + "/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BALANCED_JSON))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Numeric Degeneracy"));
    }

    // --- TEST 4: PLANO DE FASES ---
    @Test
    void phaseSpace_ShouldPassResolutionAndReturnBounds() throws Exception {
        var response = new PhaseSpaceResponse(
                List.of(new PhaseSpacePoint(0, 0, 0, 0)), 1, new PhaseSpaceResponse.Bounds(5000, 1000));
        given(simulationService.samplePhaseSpace(any(), eq(1))).willReturn(response);

        mockMvc.perform(post(ApiRoutes.SIMULATION + "/phase-space")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BALANCED_JSON.replaceFirst("\\{", "{ \"resolution\": 1,")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phaseSpace.length()").value(1))
                .andExpect(jsonPath("$.phaseSpace[0].dx").value(0.0))
                .andExpect(jsonPath("$.bounds.preyMax").value(5000.0))
                .andExpect(jsonPath("$.bounds.predatorMax").value(1000.0));
    }

    // --- TEST 5: PRESETS ---
    @Test
    void presets_ShouldReturnCatalog() throws Exception {
        given(simulationService.getPresets()).willReturn(SimulationPresets.all());

        mockMvc.perform(get(ApiRoutes.SIMULATION + "/presets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(4))
                .andExpect(jsonPath("$[0].name").value(SimulationPresets.BALANCED_ECOSYSTEM))
                .andExpect(jsonPath("$[2].parameters.environment.seasonalVariation").value(true))
                .andExpect(jsonPath("$[2].parameters.environment.seasonalAmplitude").value(0.4));
    }

    // --- TEST 6: STREAMING ---
    @Test
    void stream_ShouldStartAsyncEventStream() throws Exception {
        given(streamService.startStream(any(), isNull())).willReturn(new SseEmitter());

        mockMvc.perform(post(ApiRoutes.SIMULATION + "/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content(BALANCED_JSON))
                .andExpect(request().asyncStarted());

        verify(streamService).startStream(any(), isNull());
    }
}
