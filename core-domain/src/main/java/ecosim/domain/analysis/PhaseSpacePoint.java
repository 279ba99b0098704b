package ecosim.domain.analysis;

/**
 * Vector del campo de fases en el punto (x = presas, y = depredadores).
 */
public record PhaseSpacePoint(double x, double y, double dx, double dy) {}
