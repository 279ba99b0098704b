package ecosim.domain.dto.simulation;

import ecosim.config.SimulationParameters;

/**
 * @param parameters Parámetros del escenario.
 * @param resolution Puntos por eje; null para usar el valor por defecto (15).
 */
public record PhaseSpaceRequest(
        SimulationParameters parameters,
        Integer resolution
) {}
