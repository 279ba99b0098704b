package ecosim.domain.dto.simulation;

import ecosim.config.SimulationParameters;

public record SimulationPreset(
        String name,
        String description,
        SimulationParameters parameters
) {}
