package projectsdb.domain.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Evento de progreso emitido justo antes de que empiece el trabajo de una etapa.
 *
 * @param timestamp Marca de tiempo (no decreciente dentro de una ejecución).
 * @param state     Estado al que transita el pipeline.
 * @param label     Texto de la etapa (ej: "Reprojecting..." o "Skip Reproject...").
 */
public record ProgressEvent(Instant timestamp, PipelineState state, String label) {

    public ProgressEvent {
        Objects.requireNonNull(timestamp, "El timestamp no puede ser nulo.");
        Objects.requireNonNull(state, "El estado no puede ser nulo.");
        Objects.requireNonNull(label, "La etiqueta no puede ser nula.");
    }
}
