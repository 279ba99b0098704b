package ecosim.physics.model;

/**
 * Modelo base de recursos: el entorno ofrece siempre el mismo nivel.
 * Sirve de lienzo para {@link SeasonalResourceDecorator}.
 */
public class ConstantResourceModel implements ResourceModel {

    private final double baseLevel;

    public ConstantResourceModel(double baseLevel) {
        this.baseLevel = baseLevel;
    }

    @Override
    public double levelAt(double time) {
        return baseLevel;
    }
}
