package ecosim.compute.api;

import ecosim.compute.service.SimulationBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

@Controller
@Slf4j
@RequiredArgsConstructor
public class SimSocketController {

    private final SimulationBroadcaster broadcaster;

    /**
     * Un cliente publica el estado de su simulación local; se reenvía a todos los suscriptores.
     * STOMP SEND /app/simulation/update
     */
    @MessageMapping("/simulation/update")
    public void relaySimulationState(@Payload Object payload) {
        log.debug("Relaying client simulation state");
        broadcaster.broadcast(SimulationBroadcaster.SIMULATION_STATE, payload);
    }
}
