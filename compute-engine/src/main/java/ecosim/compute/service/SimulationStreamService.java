package ecosim.compute.service;

import ecosim.compute.config.StreamProperties;
import ecosim.compute.config.StreamSchedulerConfig;
import ecosim.config.SimulationParameters;
import ecosim.domain.dto.simulation.StreamCompleteDTO;
import ecosim.domain.dto.simulation.StreamUpdateDTO;
import ecosim.domain.ecosystem.PopulationState;
import ecosim.physics.simulator.EcosystemStepper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Streams a simulation over Server-Sent Events.
 * <p>
 * The engine does not own the cadence: this service asks the stepper for one batch every
 * {@code updateInterval} ms, publishes an {@code update} event (and a STOMP broadcast), and sends
 * a final {@code complete} event when the run is over. A client disconnect cancels the task.
 */
@Slf4j
@Service
public class SimulationStreamService {

    private final SimulatorFactory simulatorFactory;
    private final SimulationBroadcaster broadcaster;
    private final TaskScheduler scheduler;
    private final StreamProperties properties;

    public SimulationStreamService(SimulatorFactory simulatorFactory,
                                   SimulationBroadcaster broadcaster,
                                   @Qualifier(StreamSchedulerConfig.STREAM_SCHEDULER) TaskScheduler scheduler,
                                   StreamProperties properties) {
        this.simulatorFactory = simulatorFactory;
        this.broadcaster = broadcaster;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    /**
     * Validates the parameters synchronously (so errors still map to a 4xx response) and starts streaming.
     *
     * @param parameters     Scenario parameters.
     * @param updateInterval Milliseconds between batches, or null for the configured default.
     */
    public SseEmitter startStream(SimulationParameters parameters, Long updateInterval) {
        EcosystemStepper stepper = simulatorFactory.createStepper(SimulationParameters.requireValid(parameters));
        long interval = resolveInterval(updateInterval);
        String streamId = UUID.randomUUID().toString();

        SseEmitter emitter = new SseEmitter(properties.emitterTimeoutMs());
        AtomicReference<ScheduledFuture<?>> task = new AtomicReference<>();

        Runnable cancel = () -> {
            ScheduledFuture<?> future = task.get();
            if (future != null) {
                future.cancel(false);
            }
        };
        emitter.onCompletion(() -> {
            cancel.run();
            log.info("Stream {} closed", streamId);
        });
        emitter.onTimeout(() -> {
            log.warn("Stream {} timed out", streamId);
            cancel.run();
            emitter.complete();
        });
        emitter.onError(e -> {
            log.debug("Stream {} errored: {}", streamId, e.getMessage());
            cancel.run();
        });

        StreamTick tick = new StreamTick(streamId, stepper, emitter, cancel);
        task.set(scheduler.scheduleAtFixedRate(tick, Duration.ofMillis(interval)));
        // El primer tick puede terminar antes de que exista el future
        if (tick.done) {
            cancel.run();
        }
        log.info("Stream {} started (interval: {} ms)", streamId, interval);
        return emitter;
    }

    long resolveInterval(Long requested) {
        if (requested == null) {
            return properties.defaultUpdateInterval();
        }
        return Math.max(properties.minUpdateInterval(), requested);
    }

    /**
     * One scheduled tick: either finish the stream or advance one batch and publish it.
     * Ticks of the same task never overlap, so the stepper is accessed by one thread at a time.
     */
    private final class StreamTick implements Runnable {

        private final String streamId;
        private final EcosystemStepper stepper;
        private final SseEmitter emitter;
        private final Runnable cancel;
        private long step;
        private volatile boolean done;

        private StreamTick(String streamId, EcosystemStepper stepper, SseEmitter emitter, Runnable cancel) {
            this.streamId = streamId;
            this.stepper = stepper;
            this.emitter = emitter;
            this.cancel = cancel;
        }

        @Override
        public void run() {
            if (done) {
                return;
            }
            try {
                if (stepper.isFinished()) {
                    done = true;
                    emitter.send(SseEmitter.event().data(StreamCompleteDTO.of(stepper.snapshotResult()),
                            MediaType.APPLICATION_JSON));
                    emitter.complete();
                    cancel.run();
                    log.info("Stream {} completed after {} batches", streamId, step);
                    return;
                }

                PopulationState state = stepper.advanceBatch();
                StreamUpdateDTO update = StreamUpdateDTO.of(step++, state.time(), state.prey(), state.predator(),
                        stepper.getCurrentResourceLevel());

                emitter.send(SseEmitter.event().data(update, MediaType.APPLICATION_JSON));
                broadcaster.broadcast(SimulationBroadcaster.SIMULATION_UPDATE, update);
            } catch (IOException e) {
                // El cliente se ha desconectado: dejar de pedir lotes
                done = true;
                log.info("Stream {} client disconnected: {}", streamId, e.getMessage());
                cancel.run();
                emitter.completeWithError(e);
            } catch (RuntimeException e) {
                done = true;
                log.error("Stream {} failed", streamId, e);
                cancel.run();
                emitter.completeWithError(e);
            }
        }
    }
}
