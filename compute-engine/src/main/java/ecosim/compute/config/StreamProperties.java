package ecosim.compute.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ajustes del modo streaming (SSE).
 *
 * @param schedulerPoolSize     Hilos del planificador compartido por todos los streams.
 * @param emitterTimeoutMs      Tiempo máximo de vida de una conexión SSE.
 * @param defaultUpdateInterval Milisegundos entre lotes si el cliente no indica otro.
 * @param minUpdateInterval     Límite inferior aceptado para el intervalo del cliente.
 */
@ConfigurationProperties(prefix = "ecosim.stream")
public record StreamProperties(
        int schedulerPoolSize,
        long emitterTimeoutMs,
        long defaultUpdateInterval,
        long minUpdateInterval
) {
    public StreamProperties {
        if (schedulerPoolSize <= 0) schedulerPoolSize = 4;
        if (emitterTimeoutMs <= 0) emitterTimeoutMs = 600_000L;
        if (defaultUpdateInterval <= 0) defaultUpdateInterval = 100L;
        if (minUpdateInterval <= 0) minUpdateInterval = 10L;
    }
}
