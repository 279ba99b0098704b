package ecosim.physics.model;

import ecosim.config.SimulationParameters;

/**
 * Par (ecuaciones, forzamiento) que define completamente la dinámica de un escenario.
 * Se construye una vez por ejecución y es inmutable, por lo que puede compartirse entre hilos.
 */
public record EcosystemDynamics(LotkaVolterraModel model, ResourceModel resourceModel) {

    public static EcosystemDynamics of(SimulationParameters parameters) {
        SimulationParameters valid = SimulationParameters.requireValid(parameters);
        return new EcosystemDynamics(new LotkaVolterraModel(valid), ResourceModel.from(valid.environment()));
    }

    public double resourceLevelAt(double time) {
        return resourceModel.levelAt(time);
    }
}
