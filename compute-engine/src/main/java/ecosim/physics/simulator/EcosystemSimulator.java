package ecosim.physics.simulator;

import ecosim.config.SimulationConfig;
import ecosim.config.SimulationParameters;
import ecosim.domain.ecosystem.PopulationState;
import ecosim.domain.simulation.SimulationResult;
import ecosim.domain.simulation.TimeStepRecord;
import ecosim.factory.SimulationResultFactory;
import ecosim.physics.model.EcosystemDynamics;
import ecosim.physics.solver.PopulationSolver;
import ecosim.physics.solver.impl.RungeKutta4Solver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Orquesta una ejecución completa ("run to completion") del ecosistema.
 * <p>
 * Bucle principal, mientras {@code t < horizonte}:
 * <ol>
 *     <li>Registra el estado si han pasado al menos {@code recordInterval} unidades desde el último registro.</li>
 *     <li>Avanza un micro-paso RK4.</li>
 *     <li>Comprueba extinción; si ocurre, termina inmediatamente.</li>
 *     <li>Si aún no hay equilibrio, lo comprueba; al detectarlo acorta el horizonte.</li>
 *     <li>Avanza el reloj {@code dt}.</li>
 * </ol>
 * Al salir siempre se añade un registro final, aunque no toque por cadencia.
 * <p>
 * Cada instancia es una ejecución aislada y de un solo uso; no comparte estado mutable.
 */
@Slf4j
public class EcosystemSimulator {

    @Getter
    private final SimulationParameters parameters;
    private final SimulationConfig config;
    private final EcosystemDynamics dynamics;
    private final PopulationSolver solver;

    private final EquilibriumDetector equilibriumDetector;
    private final ExtinctionDetector extinctionDetector;
    private final List<TimeStepRecord> history = new ArrayList<>();

    @Getter
    private PopulationState state;
    @Getter
    private double horizon;

    private SimulationResult result;

    public EcosystemSimulator(SimulationParameters parameters) {
        this(parameters, SimulationConfig.defaults(), new RungeKutta4Solver());
    }

    /**
     * @throws ecosim.domain.exception.InvalidParametersException si faltan bloques o hay campos inválidos.
     * @throws ecosim.domain.exception.NumericDegeneracyException si la capacidad de carga es 0.
     */
    public EcosystemSimulator(SimulationParameters parameters, SimulationConfig config, PopulationSolver solver) {
        this.dynamics = EcosystemDynamics.of(parameters);
        this.parameters = parameters;
        this.config = config;
        this.solver = solver;

        this.equilibriumDetector = new EquilibriumDetector(config.getEquilibriumWindow(), config.getEquilibriumTolerance());
        this.extinctionDetector = new ExtinctionDetector(config.getExtinctionThreshold());

        this.state = PopulationState.initial(parameters);
        this.horizon = config.getMaxTime();
    }

    /**
     * Ejecuta la simulación hasta el horizonte, la extinción o el final del periodo de gracia
     * posterior al equilibrio. Llamadas repetidas devuelven el mismo resultado.
     */
    public SimulationResult runFullSimulation() {
        if (result != null) {
            return result;
        }
        log.info("Iniciando simulación completa (horizonte: {}, dt: {}, integrador: {})",
                horizon, config.getDeltaTime(), solver.getName());
        long start = System.currentTimeMillis();

        double dt = config.getDeltaTime();
        double lastRecord = 0;

        while (state.time() < horizon) {
            // 1. Registro por cadencia
            if (state.time() - lastRecord >= config.getRecordInterval()) {
                record();
                lastRecord = state.time();
            }

            // 2. Integración
            state = solver.step(state, dynamics, dt);

            // 3. Extinción
            if (extinctionDetector.check(state)) {
                log.info("Extinción detectada en t={} (presas={}, depredadores={})",
                        state.time(), state.prey(), state.predator());
                break;
            }

            // 4. Equilibrio (latch único)
            if (!equilibriumDetector.isEquilibriumReached()) {
                equilibriumDetector.check(state.time()).ifPresent(point -> {
                    double extraTime = Math.min(config.getPostEquilibriumGrace(), horizon - state.time());
                    horizon = state.time() + extraTime;
                    log.info("Equilibrio alcanzado en t={} ({} presas, {} depredadores). Nuevo horizonte: {}",
                            point.timeToReach(), point.prey(), point.predator(), horizon);
                });
            }

            // 5. Reloj
            state = state.advancedBy(dt);
        }

        // Registro final incondicional
        record();

        result = SimulationResultFactory.create(
                history,
                equilibriumDetector.getEquilibriumPoint().orElse(null),
                extinctionDetector.isExtinctionOccurred(),
                state);

        log.info("Simulación finalizada: {} registros, t={}, equilibrio={}, extinción={} ({}ms)",
                history.size(), state.time(), result.equilibriumReached(), result.extinctionOccurred(),
                System.currentTimeMillis() - start);
        return result;
    }

    private void record() {
        TimeStepRecord sample = TimeStepRecord.of(state, dynamics.resourceLevelAt(state.time()));
        history.add(sample);
        equilibriumDetector.observe(sample);
    }
}
