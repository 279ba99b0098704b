package ecosim.physics.solver;

import ecosim.domain.ecosystem.PopulationState;
import ecosim.physics.model.EcosystemDynamics;

/**
 * Avance de un micro-paso de las poblaciones.
 * <p>
 * Función pura {@code (estado, dinámica, dt) -> nuevo estado}: no guarda estado entre llamadas,
 * por lo que una misma instancia puede servir a varias simulaciones concurrentes.
 */
public interface PopulationSolver extends SolverComponent {

    /**
     * @param state    Estado en el instante t.
     * @param dynamics Ecuaciones y forzamiento del escenario.
     * @param dt       Paso de integración.
     * @return Un NUEVO estado con las poblaciones en t + dt. El reloj ({@code time}) NO se avanza:
     * eso es responsabilidad del driver.
     */
    PopulationState step(PopulationState state, EcosystemDynamics dynamics, double dt);
}
