package ecosim.compute.repository.memory;

import ecosim.compute.entity.ScenarioEntity;
import ecosim.compute.repository.ScenarioRepository;
import ecosim.config.SimulationParameters;
import ecosim.config.SimulationPresets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Catálogo de escenarios en memoria (se pierde al reiniciar).
 * <p>
 * Los ids son secuenciales ("1", "2", ...) y se arranca con dos escenarios públicos de sistema.
 */
@Slf4j
@Repository
public class InMemoryScenarioRepository implements ScenarioRepository {

    private final Map<String, ScenarioEntity> scenarios = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public InMemoryScenarioRepository() {
        seed(SimulationPresets.BALANCED_ECOSYSTEM, "A stable ecosystem with moderate populations",
                List.of("stable", "balanced"), SimulationPresets.balancedEcosystem());
        seed(SimulationPresets.PREDATOR_DOMINANT, "High predator pressure leading to potential prey extinction",
                List.of("extinction", "unstable"), SimulationPresets.predatorDominant());
        log.info("Catálogo de escenarios en memoria inicializado con {} escenarios de sistema", scenarios.size());
    }

    private void seed(String name, String description, List<String> tags,
                      SimulationParameters parameters) {
        Instant now = Instant.now();
        save(ScenarioEntity.builder()
                .name(name)
                .description(description)
                .parameters(parameters)
                .metadata(ScenarioEntity.Metadata.builder()
                        .createdBy("system")
                        .tags(new ArrayList<>(tags))
                        .publicScenario(true)
                        .build())
                .createdAt(now)
                .updatedAt(now)
                .build());
    }

    @Override
    public List<ScenarioEntity> findAll() {
        // Orden estable por id numérico (orden de inserción)
        return scenarios.values().stream()
                .sorted(Comparator.comparingLong(s -> Long.parseLong(s.getId())))
                .toList();
    }

    @Override
    public Optional<ScenarioEntity> findById(String id) {
        return Optional.ofNullable(scenarios.get(id));
    }

    @Override
    public ScenarioEntity save(ScenarioEntity scenario) {
        if (scenario.getId() == null) {
            scenario.setId(String.valueOf(nextId.getAndIncrement()));
        }
        scenarios.put(scenario.getId(), scenario);
        return scenario;
    }

    @Override
    public Optional<ScenarioEntity> update(String id, UnaryOperator<ScenarioEntity> mutation) {
        return Optional.ofNullable(scenarios.computeIfPresent(id, (key, current) -> mutation.apply(current)));
    }

    @Override
    public boolean existsById(String id) {
        return scenarios.containsKey(id);
    }

    @Override
    public void deleteById(String id) {
        scenarios.remove(id);
    }
}
