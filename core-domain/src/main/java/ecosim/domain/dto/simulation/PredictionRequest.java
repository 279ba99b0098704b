package ecosim.domain.dto.simulation;

import ecosim.config.SimulationParameters;

public record PredictionRequest(SimulationParameters parameters) {}
