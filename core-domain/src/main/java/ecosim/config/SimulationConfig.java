package ecosim.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Configuración numérica del motor de simulación.
 * <p>
 * Los valores por defecto forman parte del contrato de comportamiento del motor:
 * cambiarlos produce trayectorias distintas a las de referencia.
 */
@Value
@Builder
@With
public class SimulationConfig {

    /**
     * Paso de integración RK4 (unidades de tiempo del modelo).
     */
    @Builder.Default
    double deltaTime = 0.01;

    /**
     * Horizonte por defecto de una ejecución completa.
     */
    @Builder.Default
    double maxTime = 100.0;

    /**
     * Intervalo mínimo entre dos registros de la trayectoria.
     */
    @Builder.Default
    double recordInterval = 0.1;

    /**
     * Número de registros (no de pasos) que forman la ventana de equilibrio.
     */
    @Builder.Default
    int equilibriumWindow = 50;

    /**
     * Coeficiente de variación máximo (stddev / media) para considerar estable una población.
     */
    @Builder.Default
    double equilibriumTolerance = 0.01;

    /**
     * Tiempo extra que se sigue simulando tras detectar el equilibrio.
     */
    @Builder.Default
    double postEquilibriumGrace = 10.0;

    /**
     * Por debajo de este número de individuos una población se considera extinta.
     */
    @Builder.Default
    double extinctionThreshold = 1.0;

    /**
     * Micro-pasos por lote en el modo streaming.
     */
    @Builder.Default
    int defaultBatchSize = 10;

    public static SimulationConfig defaults() {
        return SimulationConfig.builder().build();
    }
}
