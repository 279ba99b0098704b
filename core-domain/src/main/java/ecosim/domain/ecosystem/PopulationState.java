package ecosim.domain.ecosystem;

import ecosim.config.SimulationParameters;

/**
 * Estado instantáneo del ecosistema, a precisión completa.
 * <p>
 * Inmutable: cada paso del integrador produce una nueva instancia. El reloj lo avanza
 * exclusivamente el driver de la simulación.
 */
public record PopulationState(double time, double prey, double predator) {

    public static PopulationState initial(SimulationParameters parameters) {
        return new PopulationState(0.0,
                parameters.prey().initialPopulation(),
                parameters.predator().initialPopulation());
    }

    public PopulationState withPopulations(double newPrey, double newPredator) {
        return new PopulationState(time, newPrey, newPredator);
    }

    public PopulationState advancedBy(double dt) {
        return new PopulationState(time + dt, prey, predator);
    }
}
