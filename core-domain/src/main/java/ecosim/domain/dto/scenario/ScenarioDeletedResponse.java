package ecosim.domain.dto.scenario;

public record ScenarioDeletedResponse(String message, String id) {}
