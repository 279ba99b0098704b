package ecosim.domain.dto.scenario;

import java.util.List;

public record ScenarioPageResponse(
        List<ScenarioDTO> scenarios,
        Pagination pagination
) {

    public record Pagination(long total, int page, int pages) {}
}
