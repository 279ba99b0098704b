package ecosim.domain.dto.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;
import ecosim.config.SimulationParameters;
import ecosim.domain.simulation.SimulationResult;
import lombok.Builder;

import java.util.List;

/**
 * Alta o modificación de un escenario. En modificación, los campos null se ignoran.
 */
@Builder
public record ScenarioRequest(
        String name,
        String description,
        SimulationParameters parameters,
        SimulationResult simulationResults,
        Metadata metadata
) {

    @Builder
    public record Metadata(
            String createdBy,
            List<String> tags,
            @JsonProperty("isPublic") Boolean publicScenario
    ) {}
}
