package ecosim.domain.dto.simulation;

import ecosim.domain.analysis.PhaseSpacePoint;

import java.util.List;

public record PhaseSpaceResponse(
        List<PhaseSpacePoint> phaseSpace,
        int resolution,
        Bounds bounds
) {

    public record Bounds(double preyMax, double predatorMax) {}
}
