package projectsdb.io;

import lombok.Builder;
import projectsdb.config.MethodConfig;
import projectsdb.config.ProcessingConfig;

import java.time.Instant;
import java.util.Map;

/**
 * Informe persistible de una ejecución: configuración, uso de la muestra, tiempos y métricas.
 *
 * @param stageMillis       Duración de cada etapa en milisegundos, en orden de ejecución.
 * @param medianFilterSize  Lado de la ventana del filtro de mediana de la exportación; 0 si está desactivado.
 * @param outputFiles       Archivos generados por tipo ("prediction", "train", ...), en orden de escritura.
 */
@Builder
public record RunReport(
        Instant startedAt,
        Instant finishedAt,
        String rasterSource,
        String sampleSource,
        ProcessingConfig processing,
        MethodConfig methodConfig,
        int originalSampleCount,
        int usedSampleCount,
        double usedSamplePercent,
        int trainCount,
        int testCount,
        Map<String, Long> stageMillis,
        long totalMillis,
        double rmse,
        double mae,
        double r2,
        String crs,
        int width,
        int height,
        double pixelWidth,
        double pixelHeight,
        int medianFilterSize,
        boolean medianFilterEnabled,
        Map<String, String> outputFiles
) {
}
