package ecosim.compute.service;

import ecosim.config.SimulationConfig;
import ecosim.config.SimulationParameters;
import ecosim.physics.simulator.EcosystemSimulator;
import ecosim.physics.simulator.EcosystemStepper;
import ecosim.physics.solver.PopulationSolver;
import ecosim.physics.solver.impl.RungeKutta4Solver;
import org.springframework.stereotype.Component;

@Component
public class SimulatorFactory {

    // Sin estado: una única instancia sirve a todas las simulaciones
    private final PopulationSolver solver = new RungeKutta4Solver();
    private final SimulationConfig config = SimulationConfig.defaults();

    public EcosystemSimulator createSimulator(SimulationParameters parameters) {
        return new EcosystemSimulator(parameters, config, solver);
    }

    public EcosystemStepper createStepper(SimulationParameters parameters) {
        return new EcosystemStepper(parameters, config, solver);
    }
}
