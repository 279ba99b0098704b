package ecosim.compute.repository;

import ecosim.compute.entity.ScenarioEntity;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Almacén de escenarios. El motor no conoce ningún formato de persistencia:
 * los escenarios se direccionan por un identificador opaco.
 */
public interface ScenarioRepository {

    List<ScenarioEntity> findAll();

    Optional<ScenarioEntity> findById(String id);

    /**
     * Guarda el escenario. Si no tiene id, se le asigna uno nuevo.
     */
    ScenarioEntity save(ScenarioEntity scenario);

    /**
     * Aplica una modificación de forma atómica respecto a otras modificaciones del mismo escenario.
     *
     * @return El escenario modificado, o vacío si no existe.
     */
    Optional<ScenarioEntity> update(String id, UnaryOperator<ScenarioEntity> mutation);

    boolean existsById(String id);

    void deleteById(String id);
}
