package ecosim.domain.ecosystem;

/**
 * Tasas de cambio instantáneas (dP/dt, dQ/dt).
 */
public record PopulationRates(double dPreyDt, double dPredatorDt) {}
