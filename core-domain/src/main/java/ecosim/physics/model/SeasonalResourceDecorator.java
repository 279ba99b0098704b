package ecosim.physics.model;

/**
 * Decorador Estacional.
 * <p>
 * Superpone al nivel base una sinusoide anual de periodo {@value #SEASON_PERIOD} unidades de tiempo
 * (un "año" de 12 meses) y recorta el resultado al rango físico [0, 1].
 */
public class SeasonalResourceDecorator implements ResourceModel {

    public static final double SEASON_PERIOD = 12.0;

    private final ResourceModel wrappedModel;
    private final double amplitude;

    public SeasonalResourceDecorator(ResourceModel wrappedModel, double amplitude) {
        this.wrappedModel = wrappedModel;
        this.amplitude = amplitude;
    }

    @Override
    public double levelAt(double time) {
        double base = wrappedModel.levelAt(time);
        double seasonalFactor = Math.sin(2 * Math.PI * time / SEASON_PERIOD);

        // Un entorno no puede ofrecer recursos negativos ni por encima de la saturación
        return Math.max(0, Math.min(1, base + amplitude * seasonalFactor));
    }
}
