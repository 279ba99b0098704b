package ecosim.factory;

import ecosim.domain.ecosystem.PopulationState;
import ecosim.domain.simulation.EquilibriumPoint;
import ecosim.domain.simulation.SimulationResult;
import ecosim.domain.simulation.SimulationSummary;
import ecosim.domain.simulation.TimeStepRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationResultFactoryTest {

    @Test
    @DisplayName("Resumen: extremos y media sobre registros, valores finales sobre el estado interno")
    void create_shouldSummarizeRecordsAndFinalState() {
        List<TimeStepRecord> steps = List.of(
                new TimeStepRecord(0.11, 900.0, 150.0, 0.6),
                new TimeStepRecord(0.21, 700.0, 250.0, 0.8),
                new TimeStepRecord(0.25, 650.0, 240.0, 0.7));
        PopulationState finalState = new PopulationState(0.25, 649.96, 240.04);
        EquilibriumPoint point = new EquilibriumPoint(650, 240, 0.2);

        SimulationResult result = SimulationResultFactory.create(steps, point, false, finalState);
        SimulationSummary summary = result.summary();

        assertTrue(result.equilibriumReached());
        assertSame(point, result.equilibriumPoint());
        assertEquals(0.25, summary.duration());
        assertEquals(900.0, summary.maxPrey());
        assertEquals(650.0, summary.minPrey());
        assertEquals(250.0, summary.maxPredator());
        assertEquals(150.0, summary.minPredator());
        assertEquals(649.96, summary.finalPrey());
        assertEquals(240.04, summary.finalPredator());
        assertEquals(0.7, summary.averageResourceLevel(), 1e-12);
    }

    @Test
    @DisplayName("Sin equilibrio: la bandera se deriva de la ausencia del punto")
    void create_withoutEquilibrium_shouldFlagFalse() {
        List<TimeStepRecord> steps = List.of(new TimeStepRecord(0.5, 0.9, 30, 0.7));

        SimulationResult result = SimulationResultFactory.create(steps, null, true,
                new PopulationState(0.5, 0.93, 30.2));

        assertFalse(result.equilibriumReached());
        assertTrue(result.extinctionOccurred());
        assertEquals(1, result.preview(10).getTimestepCount());
    }
}
