package ecosim.config;

import ecosim.config.SimulationParameters.EnvironmentConfig;
import ecosim.config.SimulationParameters.PredatorConfig;
import ecosim.config.SimulationParameters.PreyConfig;
import ecosim.domain.dto.simulation.SimulationPreset;

import java.util.List;

/**
 * Catálogo de escenarios de referencia.
 */
public final class SimulationPresets {

    private SimulationPresets() {}

    public static final String BALANCED_ECOSYSTEM = "Balanced Ecosystem";
    public static final String PREDATOR_DOMINANT = "Predator Dominant";
    public static final String BOOM_AND_BUST = "Boom and Bust";
    public static final String RESOURCE_SCARCITY = "Resource Scarcity";

    public static SimulationParameters balancedEcosystem() {
        return of(1000, 1.0, 5000, 100, 0.01, 0.5, 0.7, false, 0.2);
    }

    public static SimulationParameters predatorDominant() {
        return of(500, 0.8, 3000, 200, 0.02, 0.3, 0.5, false, 0.2);
    }

    public static SimulationParameters boomAndBust() {
        return of(2000, 1.5, 8000, 50, 0.015, 0.6, 0.6, true, 0.4);
    }

    public static SimulationParameters resourceScarcity() {
        return of(800, 0.6, 2000, 80, 0.008, 0.7, 0.3, false, 0.1);
    }

    public static List<SimulationPreset> all() {
        return List.of(
                new SimulationPreset(BALANCED_ECOSYSTEM,
                        "A stable ecosystem with moderate populations", balancedEcosystem()),
                new SimulationPreset(PREDATOR_DOMINANT,
                        "High predator pressure leading to potential prey extinction", predatorDominant()),
                new SimulationPreset(BOOM_AND_BUST,
                        "Cyclic populations with seasonal variation", boomAndBust()),
                new SimulationPreset(RESOURCE_SCARCITY,
                        "Limited resources constraining population growth", resourceScarcity())
        );
    }

    public static SimulationParameters of(double preyInitial, double birthRate, double carryingCapacity,
                                          double predatorInitial, double huntingEfficiency, double deathRate,
                                          double resourceAvailability, boolean seasonal, double seasonalAmplitude) {
        return SimulationParameters.builder()
                .prey(PreyConfig.builder()
                        .initialPopulation(preyInitial)
                        .birthRate(birthRate)
                        .carryingCapacity(carryingCapacity)
                        .build())
                .predator(PredatorConfig.builder()
                        .initialPopulation(predatorInitial)
                        .huntingEfficiency(huntingEfficiency)
                        .deathRate(deathRate)
                        .build())
                .environment(EnvironmentConfig.builder()
                        .resourceAvailability(resourceAvailability)
                        .seasonalVariation(seasonal)
                        .seasonalAmplitude(seasonalAmplitude)
                        .build())
                .build();
    }
}
