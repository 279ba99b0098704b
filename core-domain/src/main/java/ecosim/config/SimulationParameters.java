package ecosim.config;

import ecosim.domain.exception.InvalidParametersException;
import lombok.Builder;
import lombok.With;

/**
 * Parámetros biológicos y ambientales de un escenario depredador-presa.
 * <p>
 * Objeto de valor inmutable. Los bloques {@code prey}, {@code predator} y {@code environment}
 * son obligatorios; todos los campos numéricos deben ser finitos y no negativos.
 * Los campos numéricos son {@code Double} para poder distinguir "ausente" de "cero"
 * cuando llegan desde JSON.
 *
 * @param prey        Población de presas: tamaño inicial, tasa de natalidad y capacidad de carga.
 * @param predator    Población de depredadores: tamaño inicial, eficiencia de caza y mortalidad.
 * @param environment Disponibilidad de recursos y forzamiento estacional.
 */
@Builder
@With
public record SimulationParameters(
        PreyConfig prey,
        PredatorConfig predator,
        EnvironmentConfig environment
) {

    /**
     * Comprueba la integridad estructural de un conjunto de parámetros.
     *
     * @param parameters Parámetros recibidos (pueden ser null).
     * @return Los mismos parámetros, para encadenar.
     * @throws InvalidParametersException si falta un bloque o un campo es negativo / no finito.
     */
    public static SimulationParameters requireValid(SimulationParameters parameters) {
        if (parameters == null) {
            throw new InvalidParametersException("Parameters required");
        }
        return parameters.validate();
    }

    public SimulationParameters validate() {
        if (prey == null || predator == null || environment == null) {
            throw new InvalidParametersException(
                    "Invalid parameters. Required: prey, predator, and environment configurations");
        }
        requireNonNegative("prey.initialPopulation", prey.initialPopulation());
        requireNonNegative("prey.birthRate", prey.birthRate());
        requireNonNegative("prey.carryingCapacity", prey.carryingCapacity());
        requireNonNegative("predator.initialPopulation", predator.initialPopulation());
        requireNonNegative("predator.huntingEfficiency", predator.huntingEfficiency());
        requireNonNegative("predator.deathRate", predator.deathRate());
        requireNonNegative("environment.resourceAvailability", environment.resourceAvailability());
        requireNonNegative("environment.seasonalAmplitude", environment.seasonalAmplitude());

        if (environment.resourceAvailability() > 1.0) {
            throw new InvalidParametersException(
                    "environment.resourceAvailability must be within [0, 1], got " + environment.resourceAvailability());
        }
        return this;
    }

    private static void requireNonNegative(String field, Double value) {
        if (value == null) {
            throw new InvalidParametersException("Missing required field: " + field);
        }
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidParametersException(field + " must be a finite, non-negative number, got " + value);
        }
    }

    @Builder
    @With
    public record PreyConfig(
            Double initialPopulation,
            Double birthRate,
            Double carryingCapacity
    ) {}

    @Builder
    @With
    public record PredatorConfig(
            Double initialPopulation,
            Double huntingEfficiency,
            Double deathRate
    ) {}

    /**
     * @param resourceAvailability Nivel base de recursos en [0, 1].
     * @param seasonalVariation    Activa el ciclo estacional de periodo 12.
     * @param seasonalAmplitude    Amplitud de la sinusoide estacional (0.2 si no se indica).
     */
    @Builder
    @With
    public record EnvironmentConfig(
            Double resourceAvailability,
            boolean seasonalVariation,
            Double seasonalAmplitude
    ) {
        public static final double DEFAULT_SEASONAL_AMPLITUDE = 0.2;

        public EnvironmentConfig {
            if (seasonalAmplitude == null) {
                seasonalAmplitude = DEFAULT_SEASONAL_AMPLITUDE;
            }
        }
    }
}
