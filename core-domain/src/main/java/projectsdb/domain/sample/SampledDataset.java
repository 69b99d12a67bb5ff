package projectsdb.domain.sample;

import java.util.List;
import java.util.Objects;

/**
 * Tabla derivada del muestreo del ráster: una fila por punto conservado.
 * Columnas: una por banda, x, y, profundidad.
 */
public record SampledDataset(List<String> bandNames, List<SampleRecord> records) {

    public SampledDataset {
        bandNames = List.copyOf(Objects.requireNonNull(bandNames, "Los nombres de banda no pueden ser nulos."));
        records = List.copyOf(Objects.requireNonNull(records, "Los registros no pueden ser nulos."));
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public double[] depths() {
        return records.stream().mapToDouble(SampleRecord::depth).toArray();
    }

    public SampledDataset withRecords(List<SampleRecord> newRecords) {
        return new SampledDataset(bandNames, newRecords);
    }
}
