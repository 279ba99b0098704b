package ecosim.domain.dto.scenario;

public record DuplicateScenarioRequest(String createdBy) {}
