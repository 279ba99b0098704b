package ecosim.domain.dto.simulation;

import ecosim.config.SimulationParameters;

/**
 * Petición de ejecución completa.
 *
 * @param parameters  Parámetros del escenario.
 * @param saveResults Si es true y hay {@code scenarioId}, el resultado se guarda en el escenario.
 * @param scenarioId  Identificador opaco del escenario destino.
 */
public record SimulationRunRequest(
        SimulationParameters parameters,
        boolean saveResults,
        String scenarioId
) {}
