package ecosim.physics.simulator;

import ecosim.domain.simulation.EquilibriumPoint;
import ecosim.domain.simulation.TimeStepRecord;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Monitor de equilibrio sobre la trayectoria REGISTRADA.
 * <p>
 * Mantiene las últimas {@code windowSize} muestras registradas (no pasos de integración). Con la
 * ventana llena calcula, para cada población, el coeficiente de variación (desviación típica
 * poblacional / media); el sistema es estable si ambos quedan por debajo de la tolerancia.
 * <p>
 * La primera detección se latchea: el punto de equilibrio se fija una sola vez y nunca se sobrescribe.
 */
public class EquilibriumDetector {

    private final int windowSize;
    private final double tolerance;
    private final Deque<TimeStepRecord> window;

    // La ventana solo cambia al registrar; evita recalcular en cada micro-paso
    private boolean dirty;

    @Getter
    private boolean equilibriumReached;
    private EquilibriumPoint equilibriumPoint;

    public EquilibriumDetector(int windowSize, double tolerance) {
        this.windowSize = windowSize;
        this.tolerance = tolerance;
        this.window = new ArrayDeque<>(windowSize);
    }

    public void observe(TimeStepRecord sample) {
        if (window.size() == windowSize) {
            window.removeFirst();
        }
        window.addLast(sample);
        dirty = true;
    }

    /**
     * Evalúa la ventana actual.
     *
     * @param currentTime Instante de simulación en que se hace la comprobación.
     * @return El punto de equilibrio SOLO en la llamada que provoca la transición; vacío en cualquier otro caso.
     */
    public Optional<EquilibriumPoint> check(double currentTime) {
        if (equilibriumReached || !dirty || window.size() < windowSize) {
            return Optional.empty();
        }
        dirty = false;

        double preySum = 0;
        double predatorSum = 0;
        for (TimeStepRecord sample : window) {
            preySum += sample.preyPopulation();
            predatorSum += sample.predatorPopulation();
        }
        double avgPrey = preySum / window.size();
        double avgPredator = predatorSum / window.size();

        double preyVariance = 0;
        double predatorVariance = 0;
        for (TimeStepRecord sample : window) {
            preyVariance += Math.pow(sample.preyPopulation() - avgPrey, 2);
            predatorVariance += Math.pow(sample.predatorPopulation() - avgPredator, 2);
        }
        preyVariance /= window.size();
        predatorVariance /= window.size();

        // Media 0 -> NaN o Infinity, que nunca es menor que la tolerancia
        boolean preyStable = Math.sqrt(preyVariance) / avgPrey < tolerance;
        boolean predatorStable = Math.sqrt(predatorVariance) / avgPredator < tolerance;

        if (preyStable && predatorStable) {
            equilibriumReached = true;
            equilibriumPoint = new EquilibriumPoint(avgPrey, avgPredator, currentTime);
            return Optional.of(equilibriumPoint);
        }
        return Optional.empty();
    }

    public Optional<EquilibriumPoint> getEquilibriumPoint() {
        return Optional.ofNullable(equilibriumPoint);
    }
}
