package ecosim.compute;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import ecosim.config.SimulationPresets;
import ecosim.physics.simulator.EcosystemSimulator;

/**
 * Punto de entrada principal del Compute Engine (Backend).
 * <p>
 * Responsabilidades:
 * 1. Arrancar el contexto de Spring Boot (Web, WebSocket/STOMP).
 * 2. Verificar que el motor numérico responde antes de aceptar tráfico.
 */
@Slf4j
@SpringBootApplication(scanBasePackages = "ecosim")
@ConfigurationPropertiesScan(basePackages = "ecosim")
public class EcosimComputeApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(EcosimComputeApplication.class, args);
    }

    /**
     * Verificación de arranque ("Fail Fast"): ejecuta el escenario de referencia una vez.
     * Si el motor lanza una excepción aquí, el contexto no llega a levantarse.
     */
    @Bean
    public CommandLineRunner engineIntegrityCheck() {
        return args -> {
            log.info(">>> BOOTSTRAP: Verificando el motor de dinámica de poblaciones...");
            var result = new EcosystemSimulator(SimulationPresets.balancedEcosystem()).runFullSimulation();
            log.info(">>> BOOTSTRAP: Motor operativo ({} registros en el escenario de referencia).",
                    result.getTimestepCount());
        };
    }
}
