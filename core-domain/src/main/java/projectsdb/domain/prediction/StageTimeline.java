package projectsdb.domain.prediction;

import projectsdb.domain.event.ProgressEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Línea temporal de una ejecución a partir de sus eventos de progreso.
 * <p>
 * La duración de cada etapa es la diferencia entre marcas consecutivas; el total es la
 * diferencia entre la última y la primera.
 */
public record StageTimeline(List<ProgressEvent> events) {

    public StageTimeline {
        events = List.copyOf(Objects.requireNonNull(events));
    }

    /**
     * Duración de cada etapa, en el orden en que se emitieron los eventos.
     * Tiene un elemento menos que {@link #events()}.
     */
    public List<StageDuration> stageDurations() {
        List<StageDuration> durations = new ArrayList<>();
        for (int i = 1; i < events.size(); i++) {
            ProgressEvent start = events.get(i - 1);
            ProgressEvent end = events.get(i);
            durations.add(new StageDuration(start.label(), Duration.between(start.timestamp(), end.timestamp())));
        }
        return durations;
    }

    public Duration total() {
        if (events.size() < 2) {
            return Duration.ZERO;
        }
        return Duration.between(events.get(0).timestamp(), events.get(events.size() - 1).timestamp());
    }

    public record StageDuration(String label, Duration duration) {
    }
}
