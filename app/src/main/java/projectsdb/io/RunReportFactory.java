package projectsdb.io;

import projectsdb.domain.event.ProgressEvent;
import projectsdb.domain.prediction.PredictionResult;
import projectsdb.domain.prediction.StageTimeline;
import projectsdb.processing.postprocess.MedianFilter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Construye el {@link RunReport} a partir del resultado de una ejecución.
 */
public class RunReportFactory {

    private RunReportFactory() {
    }

    public static RunReport create(PredictionResult result, String rasterSource, String sampleSource) {
        return create(result, rasterSource, sampleSource, new MedianFilter(0), Map.of());
    }

    /**
     * @param medianFilter Filtro aplicado a la predicción exportada.
     * @param outputFiles  Archivos escritos por tipo de salida.
     */
    public static RunReport create(PredictionResult result, String rasterSource, String sampleSource,
                                   MedianFilter medianFilter, Map<String, String> outputFiles) {
        StageTimeline timeline = result.getTimeline();
        List<ProgressEvent> events = timeline.events();

        // --- 1. TIEMPOS ---
        Map<String, Long> stageMillis = new LinkedHashMap<>();
        for (StageTimeline.StageDuration stage : timeline.stageDurations()) {
            stageMillis.put(stage.label(), stage.duration().toMillis());
        }

        // --- 2. GEOMETRÍA DEL RÁSTER ---
        double[] pixelSize = result.getTransform().pixelSize();

        return RunReport.builder()
                .startedAt(events.isEmpty() ? null : events.get(0).timestamp())
                .finishedAt(events.isEmpty() ? null : events.get(events.size() - 1).timestamp())
                .rasterSource(rasterSource)
                .sampleSource(sampleSource)
                .processing(result.getConfig())
                .methodConfig(result.getMethodConfig())
                .originalSampleCount(result.getOriginalSampleCount())
                .usedSampleCount(result.getSampledDataset().size())
                .usedSamplePercent(result.usedSamplePercent())
                .trainCount(result.getTrainRecords().size())
                .testCount(result.getTestRecords().size())
                .stageMillis(stageMillis)
                .totalMillis(timeline.total().toMillis())
                .rmse(result.getMetrics().rmse())
                .mae(result.getMetrics().mae())
                .r2(result.getMetrics().r2())
                .crs(result.getCrs())
                .width(result.getWidth())
                .height(result.getHeight())
                .pixelWidth(pixelSize[0])
                .pixelHeight(pixelSize[1])
                .medianFilterSize(medianFilter.isEnabled() ? medianFilter.getSize() : 0)
                .medianFilterEnabled(medianFilter.isEnabled())
                .outputFiles(new LinkedHashMap<>(outputFiles))
                .build();
    }
}
