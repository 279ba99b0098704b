package ecosim.compute.config;

import ecosim.config.ApiRoutes;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Canal STOMP de la simulación.
 * <p>
 * Los clientes publican estados en {@code /app/simulation/update} y reciben lotes de stream y
 * reenvíos en {@link ApiRoutes#TOPIC_SIMULATION}. Sin colas por usuario.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker(ApiRoutes.TOPIC_PREFIX);
        config.setApplicationDestinationPrefixes(ApiRoutes.APP_PREFIX);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // Fallback SockJS para los clientes del frontend
        registry.addEndpoint(ApiRoutes.WS_ENDPOINT)
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }
}
