package ecosim.domain.dto.simulation;

/**
 * Sobre genérico de los mensajes difundidos por STOMP.
 */
public record SocketMessage(String type, Object data) {}
