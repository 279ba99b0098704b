package ecosim.domain.simulation;

/**
 * Punto de equilibrio observado: medias de la ventana estable y el instante en que se detectó.
 */
public record EquilibriumPoint(double prey, double predator, double timeToReach) {}
