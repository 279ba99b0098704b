package ecosim.domain.dto.simulation;

import ecosim.domain.simulation.SimulationResult;

/**
 * Evento terminal del modo streaming.
 */
public record StreamCompleteDTO(String type, SimulationResult results) {

    public static final String TYPE = "complete";

    public static StreamCompleteDTO of(SimulationResult results) {
        return new StreamCompleteDTO(TYPE, results);
    }
}
