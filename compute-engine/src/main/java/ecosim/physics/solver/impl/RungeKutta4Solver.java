package ecosim.physics.solver.impl;

import ecosim.domain.ecosystem.PopulationRates;
import ecosim.domain.ecosystem.PopulationState;
import ecosim.domain.exception.NumericDegeneracyException;
import ecosim.physics.model.EcosystemDynamics;
import ecosim.physics.model.LotkaVolterraModel;
import ecosim.physics.solver.PopulationSolver;

/**
 * Integrador Runge-Kutta clásico de 4º orden, paso fijo.
 * <p>
 * El nivel de recursos se muestrea UNA vez al inicio del paso y se reutiliza en las cuatro etapas:
 * el forzamiento se considera congelado dentro del micro-paso.
 * <p>
 * Las poblaciones resultantes se recortan a 0 por abajo.
 */
public class RungeKutta4Solver implements PopulationSolver {

    @Override
    public String getName() {
        return "RK4_FixedStep_FrozenForcing";
    }

    @Override
    public PopulationState step(PopulationState state, EcosystemDynamics dynamics, double dt) {
        LotkaVolterraModel model = dynamics.model();
        double prey = state.prey();
        double predator = state.predator();
        double resourceLevel = dynamics.resourceLevelAt(state.time());

        PopulationRates k1 = model.derivatives(prey, predator, resourceLevel);

        double k2Prey = prey + 0.5 * dt * k1.dPreyDt();
        double k2Predator = predator + 0.5 * dt * k1.dPredatorDt();
        PopulationRates k2 = model.derivatives(k2Prey, k2Predator, resourceLevel);

        double k3Prey = prey + 0.5 * dt * k2.dPreyDt();
        double k3Predator = predator + 0.5 * dt * k2.dPredatorDt();
        PopulationRates k3 = model.derivatives(k3Prey, k3Predator, resourceLevel);

        double k4Prey = prey + dt * k3.dPreyDt();
        double k4Predator = predator + dt * k3.dPredatorDt();
        PopulationRates k4 = model.derivatives(k4Prey, k4Predator, resourceLevel);

        double newPrey = Math.max(0, prey + (dt / 6)
                * (k1.dPreyDt() + 2 * k2.dPreyDt() + 2 * k3.dPreyDt() + k4.dPreyDt()));
        double newPredator = Math.max(0, predator + (dt / 6)
                * (k1.dPredatorDt() + 2 * k2.dPredatorDt() + 2 * k3.dPredatorDt() + k4.dPredatorDt()));

        // Math.max(0, NaN) devuelve NaN: hay que comprobarlo explícitamente
        if (!Double.isFinite(newPrey) || !Double.isFinite(newPredator)) {
            throw new NumericDegeneracyException(String.format(
                    "Non-finite populations at t=%.4f (prey=%s, predator=%s)", state.time(), newPrey, newPredator));
        }

        return state.withPopulations(newPrey, newPredator);
    }
}
