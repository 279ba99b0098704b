package ecosim.compute.service;

import ecosim.domain.dto.scenario.ScenarioDTO;
import ecosim.domain.dto.scenario.ScenarioPageResponse;
import ecosim.domain.dto.scenario.ScenarioQuery;
import ecosim.domain.dto.scenario.ScenarioRequest;
import ecosim.domain.simulation.SimulationResult;

import java.util.List;

/**
 * Catálogo de escenarios guardados.
 * <p>
 * Responsabilidades:
 * 1. CRUD de escenarios (parámetros + resultados opcionales + metadatos).
 * 2. Búsqueda, ordenación y paginación del catálogo.
 * 3. Métricas de popularidad (visitas y "me gusta").
 */
public interface ScenarioService {

    /**
     * Busca escenarios según filtros, con ordenación y paginación.
     */
    ScenarioPageResponse search(ScenarioQuery query);

    /**
     * Escenarios públicos más populares (puntuación = likes·2 + visitas).
     *
     * @param limit Máximo de resultados.
     */
    List<ScenarioDTO> findPopular(int limit);

    /**
     * Recupera un escenario e incrementa su contador de visitas.
     *
     * @throws ecosim.domain.exception.ResourceNotFoundException si no existe.
     */
    ScenarioDTO getScenario(String id);

    /**
     * @throws ecosim.domain.exception.InvalidParametersException si faltan nombre o parámetros.
     */
    ScenarioDTO createScenario(ScenarioRequest request);

    /**
     * Modificación parcial: los campos null de la petición no se tocan; los metadatos se fusionan.
     */
    ScenarioDTO updateScenario(String id, ScenarioRequest request);

    void deleteScenario(String id);

    /**
     * @return Número de "me gusta" tras el incremento.
     */
    long likeScenario(String id);

    /**
     * Copia privada del escenario, con contadores a cero y sin resultados.
     */
    ScenarioDTO duplicateScenario(String id, String createdBy);

    /**
     * Adjunta el resultado de una simulación a un escenario existente.
     */
    void attachResults(String id, SimulationResult results);
}
