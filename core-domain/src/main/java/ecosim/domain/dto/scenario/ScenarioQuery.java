package ecosim.domain.dto.scenario;

import lombok.Builder;
import lombok.With;

/**
 * Criterios de búsqueda del catálogo de escenarios.
 *
 * @param publicOnly Solo escenarios públicos.
 * @param createdBy  Filtra por autor (null = todos).
 * @param search     Texto buscado en nombre y descripción, sin distinguir mayúsculas.
 * @param sortBy     createdAt, updatedAt, name, views o likes.
 * @param ascending  Orden ascendente.
 * @param limit      Tamaño de página.
 * @param page       Página, empezando en 1.
 */
@Builder
@With
public record ScenarioQuery(
        boolean publicOnly,
        String createdBy,
        String search,
        String sortBy,
        boolean ascending,
        int limit,
        int page
) {}
