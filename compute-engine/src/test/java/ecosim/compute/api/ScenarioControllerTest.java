package ecosim.compute.api;

import ecosim.compute.service.ScenarioService;
import ecosim.config.ApiRoutes;
import ecosim.config.SimulationPresets;
import ecosim.domain.dto.scenario.ScenarioDTO;
import ecosim.domain.dto.scenario.ScenarioMetadataDTO;
import ecosim.domain.dto.scenario.ScenarioPageResponse;
import ecosim.domain.dto.scenario.ScenarioQuery;
import ecosim.domain.exception.InvalidParametersException;
import ecosim.domain.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ScenarioController.class)
class ScenarioControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScenarioService scenarioService;

    private static ScenarioDTO scenario(String id, String name, long likes) {
        return ScenarioDTO.builder()
                .id(id)
                .name(name)
                .description("Seeded")
                .parameters(SimulationPresets.balancedEcosystem())
                .metadata(ScenarioMetadataDTO.builder()
                        .createdBy("system")
                        .tags(List.of("stable"))
                        .publicScenario(true)
                        .likes(likes)
                        .build())
                .createdAt(Instant.parse("2025-01-01T00:00:00Z"))
                .updatedAt(Instant.parse("2025-01-01T00:00:00Z"))
                .build();
    }

    // --- TEST 1: LISTADO CON FILTROS ---
    @Test
    void listScenarios_ShouldTranslateQueryParams() throws Exception {
        // A. GIVEN
        var page = new ScenarioPageResponse(List.of(scenario("1", "Balanced Ecosystem", 3)),
                new ScenarioPageResponse.Pagination(6, 2, 2));
        given(scenarioService.search(any())).willReturn(page);

        // B. WHEN & THEN
        mockMvc.perform(get(ApiRoutes.SCENARIOS)
                        .param("public", "true")
                        .param("search", "stable")
                        .param("sortBy", "likes")
                        .param("order", "asc")
                        .param("limit", "5")
                        .param("page", "2"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scenarios[0]._id").value("1"))
                .andExpect(jsonPath("$.scenarios[0].metadata.isPublic").value(true))
                .andExpect(jsonPath("$.scenarios[0].metadata.likes").value(3))
                .andExpect(jsonPath("$.pagination.total").value(6))
                .andExpect(jsonPath("$.pagination.pages").value(2));

        ArgumentCaptor<ScenarioQuery> query = ArgumentCaptor.forClass(ScenarioQuery.class);
        verify(scenarioService).search(query.capture());
        assertTrue(query.getValue().publicOnly());
        assertTrue(query.getValue().ascending());
        assertEquals("likes", query.getValue().sortBy());
        assertEquals("stable", query.getValue().search());
        assertEquals(5, query.getValue().limit());
        assertEquals(2, query.getValue().page());
    }

    @Test
    void listScenarios_ShouldApplyDefaults() throws Exception {
        given(scenarioService.search(any())).willReturn(
                new ScenarioPageResponse(List.of(), new ScenarioPageResponse.Pagination(0, 1, 0)));

        mockMvc.perform(get(ApiRoutes.SCENARIOS)).andExpect(status().isOk());

        ArgumentCaptor<ScenarioQuery> query = ArgumentCaptor.forClass(ScenarioQuery.class);
        verify(scenarioService).search(query.capture());
        assertFalse(query.getValue().publicOnly());
        assertFalse(query.getValue().ascending());
        assertEquals("createdAt", query.getValue().sortBy());
        assertEquals(20, query.getValue().limit());
        assertEquals(1, query.getValue().page());
    }

    // --- TEST 2: LECTURA ---
    @Test
    void getScenario_ShouldReturn404_WhenMissing() throws Exception {
        given(scenarioService.getScenario("99"))
                .willThrow(new ResourceNotFoundException("Scenario not found with id: 99"));

        mockMvc.perform(get(ApiRoutes.SCENARIOS + "/{id}", "99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Scenario not found with id: 99"));
    }

    @Test
    void popular_ShouldReturnRanking() throws Exception {
        given(scenarioService.findPopular(10)).willReturn(List.of(scenario("2", "Predator Dominant", 9)));

        mockMvc.perform(get(ApiRoutes.SCENARIOS + "/popular"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Predator Dominant"));
    }

    // --- TEST 3: CRUD ---
    @Test
    void createScenario_ShouldReturn201() throws Exception {
        given(scenarioService.createScenario(any())).willReturn(scenario("3", "Mine", 0));

        mockMvc.perform(post(ApiRoutes.SCENARIOS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "name": "Mine",
                                  "parameters": {
                                    "prey": { "initialPopulation": 1000, "birthRate": 1.0, "carryingCapacity": 5000 },
                                    "predator": { "initialPopulation": 100, "huntingEfficiency": 0.01, "deathRate": 0.5 },
                                    "environment": { "resourceAvailability": 0.7, "seasonalVariation": false }
                                  },
                                  "metadata": { "createdBy": "alice", "isPublic": true }
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$._id").value("3"));
    }

    @Test
    void createScenario_ShouldReturn400_WhenNameMissing() throws Exception {
        given(scenarioService.createScenario(any()))
                .willThrow(new InvalidParametersException("Name and parameters are required"));

        mockMvc.perform(post(ApiRoutes.SCENARIOS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Name and parameters are required"));
    }

    @Test
    void updateScenario_ShouldReturn200() throws Exception {
        given(scenarioService.updateScenario(eq("1"), any())).willReturn(scenario("1", "Renamed", 0));

        mockMvc.perform(put(ApiRoutes.SCENARIOS + "/{id}", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"name\": \"Renamed\" }"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Renamed"));
    }

    @Test
    void deleteScenario_ShouldConfirmDeletion() throws Exception {
        mockMvc.perform(delete(ApiRoutes.SCENARIOS + "/{id}", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Scenario deleted successfully"))
                .andExpect(jsonPath("$.id").value("1"));

        verify(scenarioService).deleteScenario("1");
    }

    // --- TEST 4: INTERACCIÓN SOCIAL ---
    @Test
    void likeScenario_ShouldReturnNewCount() throws Exception {
        given(scenarioService.likeScenario("1")).willReturn(4L);

        mockMvc.perform(post(ApiRoutes.SCENARIOS + "/{id}/like", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.likes").value(4));
    }

    @Test
    void duplicateScenario_ShouldReturn201_WithoutBody() throws Exception {
        given(scenarioService.duplicateScenario(eq("1"), isNull()))
                .willReturn(scenario("5", "Balanced Ecosystem (Copy)", 0));

        mockMvc.perform(post(ApiRoutes.SCENARIOS + "/{id}/duplicate", "1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Balanced Ecosystem (Copy)"));
    }
}
