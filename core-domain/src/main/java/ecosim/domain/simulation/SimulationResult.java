package ecosim.domain.simulation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Resultado completo de una simulación.
 * <p>
 * La extinción y el equilibrio son desenlaces normales, codificados como banderas.
 *
 * @param timeSteps          Trayectoria registrada, en orden temporal.
 * @param equilibriumReached Si se detectó estabilidad durante la ejecución.
 * @param equilibriumPoint   Punto de equilibrio, o null si no se alcanzó.
 * @param extinctionOccurred Si alguna población cayó por debajo de un individuo.
 * @param summary            Estadísticas calculadas al terminar.
 */
public record SimulationResult(
        List<TimeStepRecord> timeSteps,
        boolean equilibriumReached,
        EquilibriumPoint equilibriumPoint,
        boolean extinctionOccurred,
        SimulationSummary summary
) {

    public SimulationResult {
        timeSteps = timeSteps == null ? List.of() : List.copyOf(timeSteps);
    }

    @JsonIgnore
    public int getTimestepCount() {
        return timeSteps.size();
    }

    /**
     * Copia del resultado con la trayectoria truncada a los primeros {@code limit} registros.
     */
    public SimulationResult preview(int limit) {
        List<TimeStepRecord> head = timeSteps.subList(0, Math.min(limit, timeSteps.size()));
        return new SimulationResult(head, equilibriumReached, equilibriumPoint, extinctionOccurred, summary);
    }
}
