package ecosim.domain.dto.simulation;

/**
 * Evento de progreso emitido tras cada lote del modo streaming.
 */
public record StreamUpdateDTO(
        String type,
        long step,
        double time,
        Populations populations,
        double resourceLevel
) {

    public static final String TYPE = "update";

    public static StreamUpdateDTO of(long step, double time, double prey, double predator, double resourceLevel) {
        return new StreamUpdateDTO(TYPE, step, time, new Populations(prey, predator), resourceLevel);
    }

    public record Populations(double prey, double predator) {}
}
