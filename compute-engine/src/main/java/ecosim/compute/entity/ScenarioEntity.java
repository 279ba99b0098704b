package ecosim.compute.entity;

import ecosim.config.SimulationParameters;
import ecosim.domain.simulation.SimulationResult;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioEntity {

    private String id; // Asignado por el repositorio

    private String name;

    private String description;

    private SimulationParameters parameters;

    private SimulationResult simulationResults;

    @Builder.Default
    private Metadata metadata = Metadata.builder().build();

    private Instant createdAt;

    private Instant updatedAt;

    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {

        @Builder.Default
        private String createdBy = "anonymous";

        @Builder.Default
        private List<String> tags = new ArrayList<>();

        private boolean publicScenario;

        private long views;

        private long likes;
    }
}
