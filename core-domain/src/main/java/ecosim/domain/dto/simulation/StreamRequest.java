package ecosim.domain.dto.simulation;

import ecosim.config.SimulationParameters;

/**
 * @param parameters     Parámetros del escenario.
 * @param updateInterval Milisegundos entre lotes; null para usar el valor del servidor.
 */
public record StreamRequest(
        SimulationParameters parameters,
        Long updateInterval
) {}
