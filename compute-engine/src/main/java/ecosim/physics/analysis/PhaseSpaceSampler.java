package ecosim.physics.analysis;

import ecosim.config.SimulationParameters;
import ecosim.domain.analysis.PhaseSpacePoint;
import ecosim.domain.ecosystem.PopulationRates;
import ecosim.domain.exception.InvalidParametersException;
import ecosim.physics.model.LotkaVolterraModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Muestreo del campo vectorial en el plano de fases (presas, depredadores).
 * <p>
 * Evalúa la función de derivadas en una rejilla N×N que cubre
 * {@code [0, K) × [0, 10·Q0)}, con el nivel BASE de recursos (sin estacionalidad).
 * Sin estado y O(N²).
 */
public final class PhaseSpaceSampler {

    public static final int DEFAULT_RESOLUTION = 20;

    /** El eje de depredadores cubre este múltiplo de la población inicial. */
    public static final double PREDATOR_RANGE_FACTOR = 10.0;

    private PhaseSpaceSampler() {}

    public static List<PhaseSpacePoint> sample(SimulationParameters parameters) {
        return sample(parameters, DEFAULT_RESOLUTION);
    }

    /**
     * @param resolution Puntos por eje (N ≥ 1).
     * @return N² puntos, recorriendo primero el eje de depredadores.
     */
    public static List<PhaseSpacePoint> sample(SimulationParameters parameters, int resolution) {
        SimulationParameters p = SimulationParameters.requireValid(parameters);
        if (resolution < 1) {
            throw new InvalidParametersException("Phase-space resolution must be at least 1, got " + resolution);
        }

        LotkaVolterraModel model = new LotkaVolterraModel(p);
        double preyRange = preyMax(p);
        double predatorRange = predatorMax(p);
        double resourceLevel = p.environment().resourceAvailability();

        List<PhaseSpacePoint> points = new ArrayList<>(resolution * resolution);
        for (int i = 0; i < resolution; i++) {
            double prey = ((double) i / resolution) * preyRange;

            for (int j = 0; j < resolution; j++) {
                double predator = ((double) j / resolution) * predatorRange;

                PopulationRates rates = model.derivatives(prey, predator, resourceLevel);
                points.add(new PhaseSpacePoint(prey, predator, rates.dPreyDt(), rates.dPredatorDt()));
            }
        }
        return points;
    }

    public static double preyMax(SimulationParameters parameters) {
        return parameters.prey().carryingCapacity();
    }

    public static double predatorMax(SimulationParameters parameters) {
        return parameters.predator().initialPopulation() * PREDATOR_RANGE_FACTOR;
    }
}
