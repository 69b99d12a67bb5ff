package projectsdb.processing.i;

import projectsdb.domain.event.PipelineFailure;
import projectsdb.domain.event.ProgressEvent;
import projectsdb.domain.prediction.PredictionResult;

/**
 * Suscriptor de los eventos de una ejecución.
 * <p>
 * Productor único y entrega ordenada: los eventos de progreso llegan en el orden de las etapas
 * y, al final, exactamente uno de {@link #onCompleted} u {@link #onFailed}.
 * Se invoca desde el hilo del pipeline; si el suscriptor necesita otro hilo, debe reenviar.
 */
public interface IPipelineListener {

    default void onProgress(ProgressEvent event) {
    }

    default void onCompleted(PredictionResult result) {
    }

    default void onFailed(PipelineFailure failure) {
    }

    /**
     * Suscriptor que ignora todos los eventos.
     */
    static IPipelineListener noop() {
        return new IPipelineListener() {
        };
    }
}
