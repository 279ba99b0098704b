package ecosim.compute.api;

import ecosim.domain.exception.InvalidParametersException;
import ecosim.domain.exception.NumericDegeneracyException;
import ecosim.domain.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Parámetros estructuralmente inválidos (bloque ausente, negativo, no finito...).
     * Log: WARN (error del cliente, sin stacktrace).
     */
    @ExceptionHandler(InvalidParametersException.class)
    public ResponseEntity<Object> handleInvalidParameters(InvalidParametersException ex) {
        log.warn("Invalid parameters: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid Parameters", ex.getMessage());
    }

    /**
     * JSON mal formado o con tipos incompatibles.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return body(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be parsed");
    }

    /**
     * División por cero o resultados no finitos en el motor.
     * Log: WARN (lo provocan los parámetros del cliente).
     */
    @ExceptionHandler(NumericDegeneracyException.class)
    public ResponseEntity<Object> handleNumericDegeneracy(NumericDegeneracyException ex) {
        log.warn("Numeric degeneracy: {}", ex.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "Numeric Degeneracy", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    /**
     * Todo lo demás.
     * Log: ERROR (incluye stacktrace completo).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message != null ? message : error
        ));
    }
}
