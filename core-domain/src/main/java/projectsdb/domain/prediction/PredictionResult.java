package projectsdb.domain.prediction;

import lombok.Builder;
import lombok.Value;
import projectsdb.config.MethodConfig;
import projectsdb.config.ProcessingConfig;
import projectsdb.domain.raster.GeoTransform;
import projectsdb.domain.sample.SampleRecord;
import projectsdb.domain.sample.SampleTable;
import projectsdb.domain.sample.SampledDataset;
import projectsdb.domain.sample.ValidatedRecord;

import java.util.List;

/**
 * Resultado agregado de una ejecución completa del pipeline.
 * <p>
 * Contiene todo lo que necesitan los colaboradores externos (informe, exportación a ráster,
 * exportación de tablas) sin volver a tocar las entradas originales.
 */
@Value
@Builder
public class PredictionResult {

    /**
     * Profundidad predicha por píxel, en orden de fila, mismo orden que el ráster de entrada.
     * Los píxeles fuera de la ventana de profundidad valen NaN cuando la limitación está activa.
     */
    double[] predictedDepth;

    int width;
    int height;
    GeoTransform transform;
    String crs;

    ValidationMetrics metrics;

    List<SampleRecord> trainRecords;
    List<ValidatedRecord> testRecords;

    /** Muestra tras reproyección y filtrado espacial. */
    SampleTable normalizedSamples;
    /** Conjunto muestreado tras la normalización de valores. */
    SampledDataset sampledDataset;
    /** Tamaño de la muestra tal y como llegó al pipeline. */
    int originalSampleCount;

    StageTimeline timeline;

    /** Configuración efectiva (con la ventana de límites ya ordenada). */
    ProcessingConfig config;
    MethodConfig methodConfig;

    public double[] getPredictedDepth() {
        return predictedDepth.clone();
    }

    /**
     * Porcentaje de la muestra original que llegó a usarse en el entrenamiento o el test.
     */
    public double usedSamplePercent() {
        if (originalSampleCount == 0) {
            return 0.0;
        }
        return 100.0 * sampledDataset.size() / originalSampleCount;
    }
}
