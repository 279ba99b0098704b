package ecosim.domain.dto.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
public record ScenarioMetadataDTO(
        String createdBy,
        List<String> tags,
        @JsonProperty("isPublic") boolean publicScenario,
        long views,
        long likes
) {}
