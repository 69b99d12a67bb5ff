package projectsdb.domain.sample;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fila del conjunto muestreado: valor de cada banda en el punto, su posición y la profundidad.
 */
public record SampleRecord(double[] bandValues, double x, double y, double depth) {

    public SampleRecord {
        bandValues = Objects.requireNonNull(bandValues, "Los valores de banda no pueden ser nulos.").clone();
    }

    @Override
    public double[] bandValues() {
        return bandValues.clone();
    }

    public double bandValue(int band) {
        return bandValues[band];
    }

    public int bandCount() {
        return bandValues.length;
    }

    public boolean hasMissingValue() {
        if (Double.isNaN(depth)) {
            return true;
        }
        for (double v : bandValues) {
            if (Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    public SampleRecord withDepth(double newDepth) {
        return new SampleRecord(bandValues, x, y, newDepth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SampleRecord that)) return false;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(depth, that.depth) == 0
                && Arrays.equals(bandValues, that.bandValues);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(x, y, depth);
        return 31 * result + Arrays.hashCode(bandValues);
    }

    @Override
    public String toString() {
        return "SampleRecord{bands=" + Arrays.toString(bandValues) + ", x=" + x + ", y=" + y + ", depth=" + depth + '}';
    }
}
