package ecosim.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Estimación analítica (heurística) del punto de equilibrio.
 */
public record EquilibriumPrediction(
        double prey,
        double predator,
        @JsonProperty("isStable") boolean stable
) {}
