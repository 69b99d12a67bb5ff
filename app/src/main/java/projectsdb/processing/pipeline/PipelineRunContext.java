package projectsdb.processing.pipeline;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectsdb.domain.event.PipelineState;
import projectsdb.domain.event.ProgressEvent;
import projectsdb.domain.prediction.StageTimeline;
import projectsdb.processing.i.IPipelineListener;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Estado mutable de una única ejecución: estado actual de la máquina de estados y eventos emitidos.
 * Solo lo usa el hilo del pipeline.
 */
@Slf4j
class PipelineRunContext {

    private final Clock clock;
    private final IPipelineListener listener;
    private final List<ProgressEvent> events = new ArrayList<>();

    @Getter
    private PipelineState state = PipelineState.IDLE;
    private Instant lastTimestamp;

    PipelineRunContext(Clock clock, IPipelineListener listener) {
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Transita a {@code next} y emite su evento de progreso antes de que empiece el trabajo de la etapa.
     */
    void enter(PipelineState next, String label) {
        transition(next);
        ProgressEvent event = new ProgressEvent(nextTimestamp(), next, label);
        events.add(event);
        log.info("[{}] {}", next, label);
        listener.onProgress(event);
    }

    /**
     * Transita sin emitir evento (la partición forma parte del paso de muestreo).
     */
    void enterSilently(PipelineState next) {
        transition(next);
        log.debug("[{}]", next);
    }

    void fail() {
        this.state = PipelineState.FAILED;
    }

    StageTimeline timeline() {
        return new StageTimeline(events);
    }

    private void transition(PipelineState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("La ejecución ya ha terminado en " + state);
        }
        if (next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException("Transición no permitida: " + state + " -> " + next);
        }
        this.state = next;
    }

    // Nunca decrece aunque el reloj del sistema retroceda.
    private Instant nextTimestamp() {
        Instant now = clock.instant();
        if (lastTimestamp != null && now.isBefore(lastTimestamp)) {
            now = lastTimestamp;
        }
        lastTimestamp = now;
        return now;
    }
}
