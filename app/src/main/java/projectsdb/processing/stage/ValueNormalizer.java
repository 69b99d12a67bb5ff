package projectsdb.processing.stage;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import projectsdb.config.ProcessingConfig;
import projectsdb.domain.sample.SampleRecord;
import projectsdb.domain.sample.SampledDataset;
import projectsdb.processing.i.IProcessingComponent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Normaliza la columna de profundidad: corrección automática de signo y ventana de profundidad.
 * El orden importa: la ventana se expresa en el convenio negativo, así que el signo se corrige antes.
 */
@Slf4j
public class ValueNormalizer implements IProcessingComponent {

    @Override
    public String getName() {
        return "Value Normalizer";
    }

    public SampledDataset normalize(SampledDataset dataset, ProcessingConfig config) {
        SampledDataset signed = applyAutoNegativeSign(dataset, config.isAutoNegativeSign());
        return applyDepthLimit(signed, config.isLimitEnabled(), config.getLimitLower(), config.getLimitUpper());
    }

    /**
     * Niega toda la columna si la mediana es positiva. Una sola pasada: no se re-evalúa.
     */
    public SampledDataset applyAutoNegativeSign(SampledDataset dataset, boolean enabled) {
        if (!enabled || dataset.isEmpty()) {
            return dataset;
        }
        double median = new Median().evaluate(dataset.depths());
        if (!(median > 0)) {
            return dataset;
        }
        log.info("Mediana de profundidad positiva ({}), se invierte el signo de la columna.", median);
        List<SampleRecord> negated = dataset.records().stream()
                .map(r -> r.withDepth(-r.depth()))
                .collect(Collectors.toList());
        return dataset.withRecords(negated);
    }

    /**
     * Conserva las filas con {@code lower <= depth <= upper} cuando la limitación está activa.
     */
    public SampledDataset applyDepthLimit(SampledDataset dataset, boolean limitEnabled, double lower, double upper) {
        if (!limitEnabled) {
            return dataset;
        }
        List<SampleRecord> kept = dataset.records().stream()
                .filter(r -> r.depth() >= lower && r.depth() <= upper)
                .collect(Collectors.toList());
        log.debug("Ventana de profundidad [{}, {}]: {} de {} filas conservadas.", lower, upper, kept.size(), dataset.size());
        return dataset.withRecords(kept);
    }
}
