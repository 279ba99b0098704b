package ecosim.physics.model;

import ecosim.config.SimulationParameters.EnvironmentConfig;

/**
 * Modelo temporal del nivel de recursos disponible para las presas.
 * <p>
 * Función pura: el mismo instante produce siempre el mismo nivel, en el rango [0, 1].
 */
@FunctionalInterface
public interface ResourceModel {

    double levelAt(double time);

    /**
     * Construye la cadena de modelos que corresponde a un entorno:
     * nivel constante, decorado con el ciclo estacional si está activado.
     */
    static ResourceModel from(EnvironmentConfig environment) {
        ResourceModel base = new ConstantResourceModel(environment.resourceAvailability());
        if (!environment.seasonalVariation()) {
            return base;
        }
        return new SeasonalResourceDecorator(base, environment.seasonalAmplitude());
    }
}
