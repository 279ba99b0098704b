package ecosim.domain.exception;

/**
 * Parámetros estructuralmente inválidos: bloque ausente, campo ausente, negativo o no finito.
 * Se lanza antes de construir ningún estado.
 */
public class InvalidParametersException extends IllegalArgumentException {

    public InvalidParametersException(String message) {
        super(message);
    }
}
