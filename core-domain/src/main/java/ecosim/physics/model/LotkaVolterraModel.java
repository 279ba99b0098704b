package ecosim.physics.model;

import ecosim.config.SimulationParameters;
import ecosim.domain.ecosystem.PopulationRates;
import ecosim.domain.exception.NumericDegeneracyException;

/**
 * Ecuaciones de Lotka-Volterra modificadas.
 * <p>
 * Presas: crecimiento logístico modulado por el nivel de recursos, menos la depredación.
 * <pre>
 *   dP = b·r·P − h·P·Q − b·P²/K
 * </pre>
 * Depredadores: crecen con la caza (con una eficiencia de conversión fija) y mueren con una
 * mortalidad que se duplica cuando las presas escasean.
 * <pre>
 *   dQ = 0.5·h·P·Q − d·Q·s,   s = 2.0 si P &lt; 10, si no 1.0
 * </pre>
 * Las tres constantes de política (0.5, 10, 2.0) son parte del comportamiento esperado del motor;
 * son los que producen los regímenes de auge/colapso y de extinción.
 */
public class LotkaVolterraModel {

    /** Fracción de la biomasa cazada que se convierte en nuevos depredadores. */
    public static final double PREDATION_CONVERSION_EFFICIENCY = 0.5;

    /** Número de presas por debajo del cual los depredadores pasan hambre. */
    public static final double STARVATION_THRESHOLD = 10.0;

    /** Multiplicador de la mortalidad de depredadores en hambruna. */
    public static final double STARVATION_MULTIPLIER = 2.0;

    private final double birthRate;
    private final double carryingCapacity;
    private final double huntingEfficiency;
    private final double deathRate;

    public LotkaVolterraModel(SimulationParameters parameters) {
        this.birthRate = parameters.prey().birthRate();
        this.carryingCapacity = parameters.prey().carryingCapacity();
        this.huntingEfficiency = parameters.predator().huntingEfficiency();
        this.deathRate = parameters.predator().deathRate();

        if (carryingCapacity == 0.0) {
            throw new NumericDegeneracyException(
                    "prey.carryingCapacity must be greater than zero (logistic term divides by it)");
        }
    }

    /**
     * Evalúa las tasas de cambio instantáneas.
     *
     * @param prey          Presas P (≥ 0).
     * @param predator      Depredadores Q (≥ 0).
     * @param resourceLevel Nivel de recursos r en [0, 1].
     * @return (dP/dt, dQ/dt).
     */
    public PopulationRates derivatives(double prey, double predator, double resourceLevel) {
        double effectiveBirthRate = birthRate * resourceLevel;

        double preyGrowth = effectiveBirthRate * prey;
        double predation = huntingEfficiency * prey * predator;
        double preyCompetition = (birthRate * prey * prey) / carryingCapacity;

        double dPreyDt = preyGrowth - predation - preyCompetition;

        double predatorGrowth = huntingEfficiency * PREDATION_CONVERSION_EFFICIENCY * prey * predator;
        double predatorDeath = deathRate * predator;
        double starvationFactor = prey < STARVATION_THRESHOLD ? STARVATION_MULTIPLIER : 1.0;

        double dPredatorDt = predatorGrowth - predatorDeath * starvationFactor;

        return new PopulationRates(dPreyDt, dPredatorDt);
    }
}
