package ecosim.domain.dto.simulation;

import ecosim.domain.simulation.SimulationResult;

public record SimulationRunResponse(
        boolean success,
        SimulationResult results,
        SimulationStatistics statistics
) {}
