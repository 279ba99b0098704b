package ecosim.physics.solver;

/**
 * Contrato mínimo de cualquier componente numérico del motor.
 */
public interface SolverComponent {

    /**
     * Nombre legible del esquema numérico (para logs y diagnósticos).
     */
    String getName();
}
