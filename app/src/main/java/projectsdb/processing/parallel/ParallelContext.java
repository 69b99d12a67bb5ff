package projectsdb.processing.parallel;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectsdb.config.ParallelismConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.function.ToDoubleFunction;

/**
 * Contexto de paralelismo con alcance de un único paso del pipeline (muestreo, ajuste, predicción).
 * <p>
 * Se abre con la configuración de la ejecución y se cierra siempre con try-with-resources,
 * de modo que el pool no sobrevive al paso ni se filtra a trabajo ajeno.
 * Los resultados no dependen del número de trabajadores: las tareas se reparten por bloques
 * contiguos y se recombinan en orden.
 */
@Slf4j
public final class ParallelContext implements AutoCloseable {

    @Getter
    private final ParallelismConfig.Backend backend;
    @Getter
    private final int workerCount;
    private final ExecutorService executor;

    private ParallelContext(ParallelismConfig.Backend backend, int workerCount, ExecutorService executor) {
        this.backend = backend;
        this.workerCount = workerCount;
        this.executor = executor;
    }

    public static ParallelContext open(ParallelismConfig config) {
        int workers = config.resolveWorkerCount(Runtime.getRuntime().availableProcessors());
        ExecutorService executor = switch (config.backend()) {
            case THREAD_POOL -> Executors.newFixedThreadPool(workers);
            case FORK_JOIN -> new ForkJoinPool(workers);
            case SEQUENTIAL -> null;
        };
        log.debug("ParallelContext abierto (backend={}, workers={})", config.backend(), workers);
        return new ParallelContext(config.backend(), workers, executor);
    }

    /**
     * Contexto sin pool, útil para pruebas y para datos pequeños.
     */
    public static ParallelContext sequential() {
        return new ParallelContext(ParallelismConfig.Backend.SEQUENTIAL, 1, null);
    }

    public boolean isSequential() {
        return executor == null;
    }

    /**
     * Ejecuta todas las tareas y devuelve sus resultados en el orden de entrada.
     */
    public <T> List<T> invokeAll(List<? extends Callable<T>> tasks) {
        List<T> results = new ArrayList<>(tasks.size());
        if (isSequential()) {
            for (Callable<T> task : tasks) {
                try {
                    results.add(task.call());
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Fallo en tarea secuencial.", e);
                }
            }
            return results;
        }

        List<Future<T>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Ejecución paralela interrumpida.", e);
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Ejecución paralela interrumpida.", e);
            } catch (ExecutionException e) {
                // Propagamos la causa original para no perder el tipo de error del pipeline.
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Error en la tarea " + i, e.getCause());
            }
        }
        return results;
    }

    /**
     * Aplica {@code function} a cada fila y devuelve los resultados en el mismo orden.
     * Las filas se reparten en tantos bloques contiguos como trabajadores.
     */
    public double[] mapRows(double[][] rows, ToDoubleFunction<double[]> function) {
        double[] out = new double[rows.length];
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int[] range : chunks(rows.length)) {
            final int from = range[0];
            final int to = range[1];
            tasks.add(() -> {
                for (int i = from; i < to; i++) {
                    out[i] = function.applyAsDouble(rows[i]);
                }
                return null;
            });
        }
        invokeAll(tasks);
        return out;
    }

    /**
     * Divide [0, size) en como mucho {@code workerCount} intervalos contiguos {from, to}.
     */
    public List<int[]> chunks(int size) {
        List<int[]> ranges = new ArrayList<>();
        if (size == 0) {
            return ranges;
        }
        int parts = Math.min(workerCount, size);
        int base = size / parts;
        int remainder = size % parts;
        int from = 0;
        for (int p = 0; p < parts; p++) {
            int length = base + (p < remainder ? 1 : 0);
            ranges.add(new int[]{from, from + length});
            from += length;
        }
        return ranges;
    }

    @Override
    public void close() {
        if (executor != null && !executor.isShutdown()) {
            executor.shutdown();
            log.debug("ParallelContext cerrado ({} trabajadores).", workerCount);
        }
    }
}
