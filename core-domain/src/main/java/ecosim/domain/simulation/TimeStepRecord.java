package ecosim.domain.simulation;

import ecosim.domain.ecosystem.PopulationState;

/**
 * Muestra registrada de la trayectoria.
 * <p>
 * Solo la salida se redondea (tiempo a 2 decimales, poblaciones a 1 decimal);
 * el estado interno de la simulación mantiene precisión completa.
 */
public record TimeStepRecord(
        double time,
        double preyPopulation,
        double predatorPopulation,
        double resourceLevel
) {

    public static TimeStepRecord of(PopulationState state, double resourceLevel) {
        return new TimeStepRecord(
                roundHalfUp(state.time(), 100),
                roundHalfUp(state.prey(), 10),
                roundHalfUp(state.predator(), 10),
                resourceLevel);
    }

    // En double: Math.round satura en Long.MAX_VALUE con poblaciones grandes
    static double roundHalfUp(double value, double scale) {
        return Math.floor(value * scale + 0.5) / scale;
    }
}
