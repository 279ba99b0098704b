package ecosim.domain.dto.simulation;

import ecosim.domain.analysis.EquilibriumPrediction;

/**
 * @param prediction  Salida del predictor analítico.
 * @param confidence  Confianza orientativa; política del servidor, no del motor.
 * @param explanation Texto para el usuario.
 */
public record PredictionResponse(
        EquilibriumPrediction prediction,
        double confidence,
        String explanation
) {}
