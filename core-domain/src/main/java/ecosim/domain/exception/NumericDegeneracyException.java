package ecosim.domain.exception;

/**
 * Degeneración numérica: división por cero o resultado no finito.
 * <p>
 * El motor falla explícitamente en lugar de dejar que NaN o Infinity se propaguen
 * a la trayectoria registrada.
 */
public class NumericDegeneracyException extends ArithmeticException {

    public NumericDegeneracyException(String message) {
        super(message);
    }
}
