package ecosim.domain.dto.scenario;

public record LikeResponse(long likes) {}
