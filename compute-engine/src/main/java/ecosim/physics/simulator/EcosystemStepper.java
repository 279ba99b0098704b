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
 * Driver paso a paso para el modo streaming.
 * <p>
 * No decide ni la cadencia ni el transporte: el host pide lotes de micro-pasos con
 * {@link #advanceBatch(int)} cuando quiere y publica el progreso como considere. Cancelar es
 * simplemente dejar de pedir lotes.
 * <p>
 * Cada micro-paso: registro por cadencia, paso RK4, avance del reloj y comprobación de extinción
 * (un lote puede terminar antes de tiempo). Este modo no evalúa el equilibrio, por lo que el
 * horizonte nunca se acorta.
 * <p>
 * NO es thread-safe: el host debe serializar las llamadas sobre una misma instancia.
 */
@Slf4j
public class EcosystemStepper {

    @Getter
    private final SimulationParameters parameters;
    private final SimulationConfig config;
    private final EcosystemDynamics dynamics;
    private final PopulationSolver solver;
    private final ExtinctionDetector extinctionDetector;
    private final List<TimeStepRecord> history = new ArrayList<>();

    @Getter
    private PopulationState state;
    @Getter
    private long batchCount;
    private double lastRecord;

    public EcosystemStepper(SimulationParameters parameters) {
        this(parameters, SimulationConfig.defaults(), new RungeKutta4Solver());
    }

    public EcosystemStepper(SimulationParameters parameters, SimulationConfig config, PopulationSolver solver) {
        this.dynamics = EcosystemDynamics.of(parameters);
        this.parameters = parameters;
        this.config = config;
        this.solver = solver;
        this.extinctionDetector = new ExtinctionDetector(config.getExtinctionThreshold());
        this.state = PopulationState.initial(parameters);
    }

    /**
     * Avanza un lote con el tamaño por defecto de la configuración.
     */
    public PopulationState advanceBatch() {
        return advanceBatch(config.getDefaultBatchSize());
    }

    /**
     * Avanza hasta {@code steps} micro-pasos de forma atómica para el llamante.
     *
     * @param steps Número de micro-pasos (≥ 1).
     * @return El estado bruto (precisión completa) tras el lote.
     */
    public PopulationState advanceBatch(int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1, got " + steps);
        }
        if (extinctionDetector.isExtinctionOccurred()) {
            return state;
        }

        double dt = config.getDeltaTime();
        for (int i = 0; i < steps; i++) {
            if (state.time() - lastRecord >= config.getRecordInterval()) {
                history.add(TimeStepRecord.of(state, getCurrentResourceLevel()));
                lastRecord = state.time();
            }

            state = solver.step(state, dynamics, dt).advancedBy(dt);

            if (extinctionDetector.check(state)) {
                log.info("Extinción detectada en t={} durante el lote {}", state.time(), batchCount);
                break;
            }
        }
        batchCount++;
        log.debug("Lote {} completado: t={}, presas={}, depredadores={}",
                batchCount, state.time(), state.prey(), state.predator());
        return state;
    }

    public double getCurrentResourceLevel() {
        return dynamics.resourceLevelAt(state.time());
    }

    public boolean isExtinctionOccurred() {
        return extinctionDetector.isExtinctionOccurred();
    }

    /**
     * La ejecución ha terminado si se alcanzó el horizonte o hubo extinción.
     */
    public boolean isFinished() {
        return state.time() >= config.getMaxTime() || extinctionDetector.isExtinctionOccurred();
    }

    /**
     * Instantánea del resultado hasta ahora: la trayectoria registrada más un registro del estado actual.
     * No modifica el estado del stepper.
     */
    public SimulationResult snapshotResult() {
        List<TimeStepRecord> timeSteps = new ArrayList<>(history);
        timeSteps.add(TimeStepRecord.of(state, getCurrentResourceLevel()));
        return SimulationResultFactory.create(timeSteps, null, extinctionDetector.isExtinctionOccurred(), state);
    }
}
