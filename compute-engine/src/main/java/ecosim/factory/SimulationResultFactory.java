package ecosim.factory;

import ecosim.domain.ecosystem.PopulationState;
import ecosim.domain.simulation.EquilibriumPoint;
import ecosim.domain.simulation.SimulationResult;
import ecosim.domain.simulation.SimulationSummary;
import ecosim.domain.simulation.TimeStepRecord;

import java.util.List;

/**
 * Factoría para ensamblar el {@link SimulationResult} al final de una ejecución.
 * <p>
 * El resumen se calcula en una única pasada sobre la trayectoria registrada.
 */
public final class SimulationResultFactory {

    private SimulationResultFactory() {}

    /**
     * @param timeSteps          Trayectoria registrada (incluye el registro final forzado).
     * @param equilibriumPoint   Punto de equilibrio, o null.
     * @param extinctionOccurred Bandera de extinción.
     * @param finalState         Estado interno a precisión completa al terminar.
     */
    public static SimulationResult create(List<TimeStepRecord> timeSteps,
                                          EquilibriumPoint equilibriumPoint,
                                          boolean extinctionOccurred,
                                          PopulationState finalState) {
        return new SimulationResult(
                timeSteps,
                equilibriumPoint != null,
                equilibriumPoint,
                extinctionOccurred,
                summarize(timeSteps, finalState));
    }

    static SimulationSummary summarize(List<TimeStepRecord> timeSteps, PopulationState finalState) {
        if (timeSteps.isEmpty()) {
            return SimulationSummary.builder()
                    .duration(finalState.time())
                    .maxPrey(finalState.prey())
                    .maxPredator(finalState.predator())
                    .minPrey(finalState.prey())
                    .minPredator(finalState.predator())
                    .finalPrey(finalState.prey())
                    .finalPredator(finalState.predator())
                    .averageResourceLevel(0.0)
                    .build();
        }

        double maxPrey = Double.NEGATIVE_INFINITY;
        double maxPredator = Double.NEGATIVE_INFINITY;
        double minPrey = Double.POSITIVE_INFINITY;
        double minPredator = Double.POSITIVE_INFINITY;
        double resourceSum = 0;

        for (TimeStepRecord record : timeSteps) {
            maxPrey = Math.max(maxPrey, record.preyPopulation());
            maxPredator = Math.max(maxPredator, record.predatorPopulation());
            minPrey = Math.min(minPrey, record.preyPopulation());
            minPredator = Math.min(minPredator, record.predatorPopulation());
            resourceSum += record.resourceLevel();
        }

        return SimulationSummary.builder()
                .duration(finalState.time())
                .maxPrey(maxPrey)
                .maxPredator(maxPredator)
                .minPrey(minPrey)
                .minPredator(minPredator)
                .finalPrey(finalState.prey())
                .finalPredator(finalState.predator())
                .averageResourceLevel(resourceSum / timeSteps.size())
                .build();
    }
}
