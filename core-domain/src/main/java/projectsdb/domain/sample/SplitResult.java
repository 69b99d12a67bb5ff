package projectsdb.domain.sample;

import java.util.List;
import java.util.Objects;

/**
 * Particiones disjuntas de entrenamiento y test de un {@link SampledDataset}.
 * <p>
 * Los registros completos (bandas + x + y + profundidad) se conservan para informes y exportación;
 * las matrices de características solo contienen las bandas. Los registros de test están
 * re-indexados de 0 a n-1, en el orden en que se validarán.
 */
public record SplitResult(List<SampleRecord> trainRecords, List<SampleRecord> testRecords) {

    public SplitResult {
        trainRecords = List.copyOf(Objects.requireNonNull(trainRecords));
        testRecords = List.copyOf(Objects.requireNonNull(testRecords));
    }

    public int trainSize() {
        return trainRecords.size();
    }

    public int testSize() {
        return testRecords.size();
    }

    public double[][] trainFeatures() {
        return features(trainRecords);
    }

    public double[] trainTargets() {
        return targets(trainRecords);
    }

    public double[][] testFeatures() {
        return features(testRecords);
    }

    public double[] testTargets() {
        return targets(testRecords);
    }

    private static double[][] features(List<SampleRecord> records) {
        return records.stream().map(SampleRecord::bandValues).toArray(double[][]::new);
    }

    private static double[] targets(List<SampleRecord> records) {
        return records.stream().mapToDouble(SampleRecord::depth).toArray();
    }
}
