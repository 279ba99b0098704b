package ecosim.compute.service;

import ecosim.config.ApiRoutes;
import ecosim.domain.dto.simulation.SocketMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Difunde eventos de simulación a los suscriptores de {@code /topic/simulation}.
 * <p>
 * Los fallos del broker se registran y no se propagan.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulationBroadcaster {

    public static final String SIMULATION_COMPLETE = "simulation_complete";
    public static final String SIMULATION_UPDATE = "simulation_update";
    public static final String SIMULATION_STATE = "simulation_state";

    private final SimpMessagingTemplate messagingTemplate;

    public void broadcast(String type, Object data) {
        try {
            messagingTemplate.convertAndSend(ApiRoutes.TOPIC_SIMULATION, new SocketMessage(type, data));
            log.debug("Sent {} to {}", type, ApiRoutes.TOPIC_SIMULATION);
        } catch (MessagingException e) {
            log.warn("Broadcast of {} failed: {}", type, e.getMessage());
        }
    }
}
