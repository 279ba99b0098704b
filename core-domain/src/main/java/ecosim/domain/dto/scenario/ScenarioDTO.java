package ecosim.domain.dto.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;
import ecosim.config.SimulationParameters;
import ecosim.domain.simulation.SimulationResult;
import lombok.Builder;

import java.time.Instant;

/**
 * Vista pública de un escenario guardado.
 */
@Builder
public record ScenarioDTO(
        @JsonProperty("_id") String id,
        String name,
        String description,
        SimulationParameters parameters,
        SimulationResult simulationResults,
        ScenarioMetadataDTO metadata,
        Instant createdAt,
        Instant updatedAt
) {}
