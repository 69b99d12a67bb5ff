package projectsdb.processing.pipeline;

import lombok.extern.slf4j.Slf4j;
import projectsdb.domain.event.FailureReason;
import projectsdb.domain.event.PipelineFailure;
import projectsdb.domain.exception.SdbProcessingException;
import projectsdb.domain.prediction.PredictionResult;
import projectsdb.processing.i.IPipelineListener;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Ejecuta el pipeline en un único hilo de fondo, de modo que el llamador nunca se bloquea y
 * dos ejecuciones nunca se solapan (las peticiones se encolan).
 * <p>
 * El suscriptor recibe los eventos de progreso en orden y después exactamente uno de
 * {@code onCompleted} u {@code onFailed}. El futuro devuelto se completa con el resultado o,
 * en caso de fallo, excepcionalmente con la causa original.
 */
@Slf4j
public class PipelineRunner implements AutoCloseable {

    private final BathymetryPipeline pipeline;
    private final Clock clock;
    private final ExecutorService worker;

    public PipelineRunner(BathymetryPipeline pipeline) {
        this(pipeline, Clock.systemUTC());
    }

    public PipelineRunner(BathymetryPipeline pipeline, Clock clock) {
        this.pipeline = pipeline;
        this.clock = clock;
        this.worker = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "sdb-pipeline");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Encola una ejecución.
     *
     * @throws java.util.concurrent.RejectedExecutionException si el runner ya se ha cerrado.
     */
    public CompletableFuture<PredictionResult> submit(PipelineRequest request, IPipelineListener listener) {
        IPipelineListener target = listener == null ? IPipelineListener.noop() : listener;
        return CompletableFuture.supplyAsync(() -> execute(request, target), worker);
    }

    PredictionResult execute(PipelineRequest request, IPipelineListener listener) {
        PredictionResult result;
        try {
            result = pipeline.run(request, listener);
        } catch (SdbProcessingException e) {
            log.warn("Ejecución fallida ({}): {}", e.getReason(), e.getMessage());
            listener.onFailed(new PipelineFailure(clock.instant(), e.getReason(), e.getMessage()));
            throw e;
        } catch (RuntimeException e) {
            log.error("Error inesperado durante la ejecución del pipeline.", e);
            listener.onFailed(new PipelineFailure(clock.instant(), FailureReason.UNEXPECTED, String.valueOf(e.getMessage())));
            throw e;
        }
        log.info("Ejecución completada: RMSE={}, MAE={}, R2={}", result.getMetrics().rmse(),
                result.getMetrics().mae(), result.getMetrics().r2());
        listener.onCompleted(result);
        return result;
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("El hilo del pipeline sigue ocupado; se fuerza la parada.");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
