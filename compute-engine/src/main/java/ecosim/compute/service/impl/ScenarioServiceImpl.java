package ecosim.compute.service.impl;

import ecosim.compute.entity.ScenarioEntity;
import ecosim.compute.repository.ScenarioRepository;
import ecosim.compute.service.ScenarioService;
import ecosim.config.SimulationParameters;
import ecosim.domain.dto.scenario.ScenarioDTO;
import ecosim.domain.dto.scenario.ScenarioMetadataDTO;
import ecosim.domain.dto.scenario.ScenarioPageResponse;
import ecosim.domain.dto.scenario.ScenarioQuery;
import ecosim.domain.dto.scenario.ScenarioRequest;
import ecosim.domain.exception.InvalidParametersException;
import ecosim.domain.exception.ResourceNotFoundException;
import ecosim.domain.simulation.SimulationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioServiceImpl implements ScenarioService {

    private final ScenarioRepository scenarioRepository;

    // =========================================================================
    // 1. CONSULTAS
    // =========================================================================

    @Override
    public ScenarioPageResponse search(ScenarioQuery query) {
        int limit = Math.max(1, query.limit());
        int page = Math.max(1, query.page());

        Stream<ScenarioEntity> stream = scenarioRepository.findAll().stream();
        if (query.publicOnly()) {
            stream = stream.filter(s -> s.getMetadata().isPublicScenario());
        }
        if (query.createdBy() != null && !query.createdBy().isBlank()) {
            stream = stream.filter(s -> query.createdBy().equals(s.getMetadata().getCreatedBy()));
        }
        if (query.search() != null && !query.search().isBlank()) {
            String needle = query.search().toLowerCase(Locale.ROOT);
            stream = stream.filter(s -> contains(s.getName(), needle) || contains(s.getDescription(), needle));
        }

        Comparator<ScenarioEntity> comparator = comparatorFor(query.sortBy());
        if (!query.ascending()) {
            comparator = comparator.reversed();
        }
        List<ScenarioEntity> filtered = stream.sorted(comparator).toList();

        int from = (int) Math.min((long) (page - 1) * limit, filtered.size());
        int to = Math.min(from + limit, filtered.size());
        List<ScenarioDTO> content = filtered.subList(from, to).stream().map(this::mapToDto).toList();

        int pages = (int) Math.ceil((double) filtered.size() / limit);
        return new ScenarioPageResponse(content, new ScenarioPageResponse.Pagination(filtered.size(), page, pages));
    }

    @Override
    public List<ScenarioDTO> findPopular(int limit) {
        return scenarioRepository.findAll().stream()
                .filter(s -> s.getMetadata().isPublicScenario())
                .sorted(Comparator.comparingLong(ScenarioServiceImpl::popularityScore).reversed())
                .limit(limit)
                .map(this::mapToDto)
                .toList();
    }

    @Override
    public ScenarioDTO getScenario(String id) {
        ScenarioEntity entity = scenarioRepository.update(id, s -> {
            s.getMetadata().setViews(s.getMetadata().getViews() + 1);
            return s;
        }).orElseThrow(() -> notFound(id));
        return mapToDto(entity);
    }

    // =========================================================================
    // 2. GESTIÓN DEL CICLO DE VIDA
    // =========================================================================

    @Override
    public ScenarioDTO createScenario(ScenarioRequest request) {
        if (request == null || request.name() == null || request.name().isBlank() || request.parameters() == null) {
            throw new InvalidParametersException("Name and parameters are required");
        }
        SimulationParameters.requireValid(request.parameters());

        ScenarioRequest.Metadata requestedMetadata = request.metadata();
        ScenarioEntity.Metadata metadata = ScenarioEntity.Metadata.builder().build();
        if (requestedMetadata != null) {
            applyMetadata(metadata, requestedMetadata);
        }

        Instant now = Instant.now();
        ScenarioEntity saved = scenarioRepository.save(ScenarioEntity.builder()
                .name(request.name())
                .description(request.description())
                .parameters(request.parameters())
                .simulationResults(request.simulationResults())
                .metadata(metadata)
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("Escenario creado: {} ({})", saved.getId(), saved.getName());
        return mapToDto(saved);
    }

    @Override
    public ScenarioDTO updateScenario(String id, ScenarioRequest request) {
        if (request.parameters() != null) {
            SimulationParameters.requireValid(request.parameters());
        }

        ScenarioEntity updated = scenarioRepository.update(id, s -> {
            if (request.name() != null && !request.name().isBlank()) s.setName(request.name());
            if (request.description() != null) s.setDescription(request.description());
            if (request.parameters() != null) s.setParameters(request.parameters());
            if (request.simulationResults() != null) s.setSimulationResults(request.simulationResults());
            if (request.metadata() != null) applyMetadata(s.getMetadata(), request.metadata());
            s.setUpdatedAt(Instant.now());
            return s;
        }).orElseThrow(() -> notFound(id));

        log.info("Escenario actualizado: {}", id);
        return mapToDto(updated);
    }

    @Override
    public void deleteScenario(String id) {
        if (!scenarioRepository.existsById(id)) {
            throw notFound(id);
        }
        scenarioRepository.deleteById(id);
        log.info("Escenario eliminado: {}", id);
    }

    @Override
    public long likeScenario(String id) {
        ScenarioEntity entity = scenarioRepository.update(id, s -> {
            s.getMetadata().setLikes(s.getMetadata().getLikes() + 1);
            return s;
        }).orElseThrow(() -> notFound(id));
        return entity.getMetadata().getLikes();
    }

    @Override
    public ScenarioDTO duplicateScenario(String id, String createdBy) {
        ScenarioEntity original = scenarioRepository.findById(id).orElseThrow(() -> notFound(id));

        Instant now = Instant.now();
        ScenarioEntity copy = ScenarioEntity.builder()
                .name(original.getName() + " (Copy)")
                .description(original.getDescription())
                // Parámetros inmutables: se comparte la instancia
                .parameters(original.getParameters())
                .metadata(ScenarioEntity.Metadata.builder()
                        .createdBy(createdBy != null && !createdBy.isBlank() ? createdBy : "anonymous")
                        .tags(original.getMetadata().getTags() == null
                                ? new ArrayList<>() : new ArrayList<>(original.getMetadata().getTags()))
                        .publicScenario(false)
                        .build())
                .createdAt(now)
                .updatedAt(now)
                .build();

        ScenarioEntity saved = scenarioRepository.save(copy);
        log.info("Escenario {} duplicado como {}", id, saved.getId());
        return mapToDto(saved);
    }

    @Override
    public void attachResults(String id, SimulationResult results) {
        scenarioRepository.update(id, s -> {
            s.setSimulationResults(results);
            s.setUpdatedAt(Instant.now());
            return s;
        }).orElseThrow(() -> notFound(id));
        log.info("Resultados de simulación guardados en el escenario {}", id);
    }

    // =========================================================================
    // 3. HELPERS
    // =========================================================================

    private static void applyMetadata(ScenarioEntity.Metadata target, ScenarioRequest.Metadata source) {
        if (source.createdBy() != null && !source.createdBy().isBlank()) target.setCreatedBy(source.createdBy());
        if (source.tags() != null) target.setTags(new ArrayList<>(source.tags()));
        if (source.publicScenario() != null) target.setPublicScenario(source.publicScenario());
    }

    private static Comparator<ScenarioEntity> comparatorFor(String sortBy) {
        if (sortBy == null) {
            return Comparator.comparing(ScenarioEntity::getCreatedAt);
        }
        return switch (sortBy) {
            case "updatedAt" -> Comparator.comparing(ScenarioEntity::getUpdatedAt);
            case "name" -> Comparator.comparing(s -> s.getName().toLowerCase(Locale.ROOT));
            case "views" -> Comparator.comparingLong(s -> s.getMetadata().getViews());
            case "likes" -> Comparator.comparingLong(s -> s.getMetadata().getLikes());
            default -> Comparator.comparing(ScenarioEntity::getCreatedAt);
        };
    }

    private static long popularityScore(ScenarioEntity s) {
        return s.getMetadata().getLikes() * 2 + s.getMetadata().getViews();
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static ResourceNotFoundException notFound(String id) {
        return new ResourceNotFoundException("Scenario not found with id: " + id);
    }

    private ScenarioDTO mapToDto(ScenarioEntity entity) {
        ScenarioEntity.Metadata m = entity.getMetadata();
        return ScenarioDTO.builder()
                .id(entity.getId())
                .name(entity.getName())
                .description(entity.getDescription())
                .parameters(entity.getParameters())
                .simulationResults(entity.getSimulationResults())
                .metadata(ScenarioMetadataDTO.builder()
                        .createdBy(m.getCreatedBy())
                        .tags(m.getTags() == null ? List.of() : List.copyOf(m.getTags()))
                        .publicScenario(m.isPublicScenario())
                        .views(m.getViews())
                        .likes(m.getLikes())
                        .build())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
