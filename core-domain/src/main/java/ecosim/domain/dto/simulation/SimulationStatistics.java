package ecosim.domain.dto.simulation;

public record SimulationStatistics(
        int totalTimeSteps,
        double simulationDuration,
        boolean equilibriumReached,
        boolean extinctionOccurred
) {}
