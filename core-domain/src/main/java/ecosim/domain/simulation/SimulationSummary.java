package ecosim.domain.simulation;

import lombok.Builder;

/**
 * Estadísticas agregadas de una ejecución.
 * <p>
 * Máximos, mínimos y media de recursos salen de la trayectoria registrada (valores redondeados);
 * {@code finalPrey}/{@code finalPredator} son el estado interno a precisión completa.
 */
@Builder
public record SimulationSummary(
        double duration,
        double maxPrey,
        double maxPredator,
        double minPrey,
        double minPredator,
        double finalPrey,
        double finalPredator,
        double averageResourceLevel
) {}
