package projectsdb.config;

import lombok.Builder;
import lombok.With;

/**
 * Pistas de paralelismo para los pasos costosos del pipeline (muestreo, ajuste y predicción).
 * <p>
 * Es una perilla de rendimiento, no de corrección: una ejecución secuencial produce
 * exactamente el mismo resultado.
 *
 * @param backend     Tipo de pool de trabajadores.
 * @param workerCount Número de trabajadores. Nunca 0. Los valores negativos cuentan hacia atrás
 *                    desde los procesadores disponibles (-1 = todos, -2 = todos menos uno).
 * @param randomSeed  Semilla del reparto train/test.
 */
@Builder
@With
public record ParallelismConfig(
        Backend backend,
        int workerCount,
        long randomSeed
) {

    public ParallelismConfig {
        if (backend == null) {
            backend = Backend.THREAD_POOL;
        }
    }

    public static ParallelismConfig defaults() {
        return new ParallelismConfig(Backend.THREAD_POOL, -2, 0L);
    }

    /**
     * Traduce {@link #workerCount()} a un número efectivo de hilos (siempre >= 1).
     *
     * @param availableProcessors Procesadores visibles por la JVM.
     */
    public int resolveWorkerCount(int availableProcessors) {
        if (backend == Backend.SEQUENTIAL) {
            return 1;
        }
        if (workerCount > 0) {
            return workerCount;
        }
        // -1 -> todos, -2 -> todos menos uno, ...
        return Math.max(1, availableProcessors + 1 + workerCount);
    }

    public enum Backend {
        /** Pool fijo de hilos ({@code Executors.newFixedThreadPool}). */
        THREAD_POOL,
        /** {@code ForkJoinPool} dedicado; los streams paralelos anidados se quedan dentro. */
        FORK_JOIN,
        /** Sin pool: todo se ejecuta en el hilo del pipeline. */
        SEQUENTIAL
    }
}
