package ecosim.compute.service;

import ecosim.config.SimulationParameters;
import ecosim.config.SimulationPresets;
import ecosim.domain.analysis.EquilibriumPrediction;
import ecosim.domain.analysis.PhaseSpacePoint;
import ecosim.domain.dto.simulation.PhaseSpaceResponse;
import ecosim.domain.dto.simulation.PredictionResponse;
import ecosim.domain.dto.simulation.SimulationPreset;
import ecosim.domain.dto.simulation.SimulationRunRequest;
import ecosim.domain.dto.simulation.SimulationRunResponse;
import ecosim.domain.dto.simulation.SimulationStatistics;
import ecosim.domain.simulation.SimulationResult;
import ecosim.physics.analysis.EquilibriumPredictor;
import ecosim.physics.analysis.PhaseSpaceSampler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class SimulationService {

    public static final int PREVIEW_SIZE = 10;
    public static final int DEFAULT_PHASE_SPACE_RESOLUTION = 15;

    static final double STABLE_CONFIDENCE = 0.8;
    static final double UNSTABLE_CONFIDENCE = 0.3;

    private final SimulatorFactory simulatorFactory;
    private final ScenarioService scenarioService;
    private final SimulationBroadcaster broadcaster;

    /**
     * Executes a full simulation synchronously.
     * Broadcasts a light preview and, if requested, stores the result on the scenario.
     *
     * @param request Parameters plus optional persistence target.
     * @return Result and headline statistics.
     */
    public SimulationRunResponse runSimulation(SimulationRunRequest request) {
        SimulationParameters parameters = SimulationParameters.requireValid(request.parameters());
        log.info("Starting simulation (prey: {}, predators: {}, seasonal: {})",
                parameters.prey().initialPopulation(), parameters.predator().initialPopulation(),
                parameters.environment().seasonalVariation());

        SimulationResult result = simulatorFactory.createSimulator(parameters).runFullSimulation();

        broadcaster.broadcast(SimulationBroadcaster.SIMULATION_COMPLETE, Map.of(
                "parameters", parameters,
                "results", result.preview(PREVIEW_SIZE)));

        if (request.saveResults() && request.scenarioId() != null) {
            scenarioService.attachResults(request.scenarioId(), result);
        }

        SimulationStatistics statistics = new SimulationStatistics(
                result.getTimestepCount(),
                result.summary().duration(),
                result.equilibriumReached(),
                result.extinctionOccurred());

        log.info("Simulation completed: {} records, duration {}", statistics.totalTimeSteps(),
                statistics.simulationDuration());
        return new SimulationRunResponse(true, result, statistics);
    }

    /**
     * Analytic equilibrium estimate. Confidence is a host-side policy on top of the engine output.
     */
    public PredictionResponse predictEquilibrium(SimulationParameters parameters) {
        EquilibriumPrediction prediction = EquilibriumPredictor.predict(parameters);
        return new PredictionResponse(
                prediction,
                prediction.stable() ? STABLE_CONFIDENCE : UNSTABLE_CONFIDENCE,
                prediction.stable()
                        ? "The system is likely to reach a stable equilibrium with these parameters."
                        : "The system may be unstable or lead to extinction with these parameters.");
    }

    public PhaseSpaceResponse samplePhaseSpace(SimulationParameters parameters, Integer resolution) {
        int points = resolution != null ? resolution : DEFAULT_PHASE_SPACE_RESOLUTION;
        List<PhaseSpacePoint> phaseSpace = PhaseSpaceSampler.sample(parameters, points);

        // Los límites se repiten aquí para el cliente; el muestreador no los devuelve
        return new PhaseSpaceResponse(phaseSpace, points, new PhaseSpaceResponse.Bounds(
                PhaseSpaceSampler.preyMax(parameters),
                PhaseSpaceSampler.predatorMax(parameters)));
    }

    public List<SimulationPreset> getPresets() {
        return SimulationPresets.all();
    }
}
