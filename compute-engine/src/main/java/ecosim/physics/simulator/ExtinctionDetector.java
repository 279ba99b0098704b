package ecosim.physics.simulator;

import ecosim.domain.ecosystem.PopulationState;

/**
 * Monitor de extinción. Se consulta tras CADA micro-paso de integración.
 * <p>
 * La bandera es irreversible: una vez extinta, la ejecución termina.
 */
public class ExtinctionDetector {

    private final double threshold;
    private boolean extinctionOccurred;

    public ExtinctionDetector(double threshold) {
        this.threshold = threshold;
    }

    /**
     * @return true si alguna población está por debajo del umbral (y queda registrado).
     */
    public boolean check(PopulationState state) {
        if (state.prey() < threshold || state.predator() < threshold) {
            extinctionOccurred = true;
            return true;
        }
        return false;
    }

    public boolean isExtinctionOccurred() {
        return extinctionOccurred;
    }
}
