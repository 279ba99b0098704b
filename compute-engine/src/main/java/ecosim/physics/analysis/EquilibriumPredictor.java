package ecosim.physics.analysis;

import ecosim.config.SimulationParameters;
import ecosim.domain.analysis.EquilibriumPrediction;
import ecosim.domain.exception.NumericDegeneracyException;
import ecosim.physics.model.LotkaVolterraModel;

/**
 * Estimador analítico del punto de equilibrio, sin integrar ninguna trayectoria.
 * <p>
 * HEURÍSTICO: usa las isoclinas del Lotka-Volterra clásico sin forzamiento estacional, ignora el
 * término logístico y la penalización por hambruna, y solo recorta la presa al 80% de la capacidad
 * de carga. No garantiza que la simulación real converja a ese punto (ni siquiera que converja).
 * <pre>
 *   P* = d / (0.5·h)
 *   Q* = b·r / h
 * </pre>
 */
public final class EquilibriumPredictor {

    /** Fracción de la capacidad de carga que actúa como techo de la estimación de presas. */
    public static final double CARRYING_CAPACITY_CAP = 0.8;

    private EquilibriumPredictor() {}

    /**
     * @throws NumericDegeneracyException si {@code huntingEfficiency} es 0.
     */
    public static EquilibriumPrediction predict(SimulationParameters parameters) {
        SimulationParameters p = SimulationParameters.requireValid(parameters);
        double huntingEfficiency = p.predator().huntingEfficiency();

        if (huntingEfficiency == 0.0) {
            throw new NumericDegeneracyException(
                    "Cannot predict equilibrium: predator.huntingEfficiency is zero (division by zero)");
        }

        double preyEquilibrium = p.predator().deathRate()
                / (huntingEfficiency * LotkaVolterraModel.PREDATION_CONVERSION_EFFICIENCY);
        double predatorEquilibrium = (p.prey().birthRate() * p.environment().resourceAvailability())
                / huntingEfficiency;

        if (!Double.isFinite(preyEquilibrium) || !Double.isFinite(predatorEquilibrium)) {
            throw new NumericDegeneracyException(String.format(
                    "Equilibrium estimate is not finite (prey=%s, predator=%s)", preyEquilibrium, predatorEquilibrium));
        }

        double adjustedPreyEquilibrium = Math.min(preyEquilibrium,
                p.prey().carryingCapacity() * CARRYING_CAPACITY_CAP);

        return new EquilibriumPrediction(
                adjustedPreyEquilibrium,
                predatorEquilibrium,
                adjustedPreyEquilibrium > 0 && predatorEquilibrium > 0);
    }
}
