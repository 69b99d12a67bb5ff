package projectsdb.processing.stage;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import projectsdb.domain.prediction.ValidationMetrics;
import projectsdb.domain.sample.SampleRecord;
import projectsdb.domain.sample.SplitResult;
import projectsdb.domain.sample.ValidatedRecord;
import projectsdb.processing.i.IProcessingComponent;
import projectsdb.processing.i.IRegressor;
import projectsdb.processing.parallel.ParallelContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Predice sobre el conjunto de test y calcula RMSE, MAE y R².
 */
@Slf4j
public class Validator implements IProcessingComponent {

    public static final String STAGE_LABEL = "Validating...";

    @Override
    public String getName() {
        return "Validator";
    }

    public Outcome validate(IRegressor regressor, SplitResult split, ParallelContext context) {
        double[] actual = split.testTargets();
        double[] predicted = regressor.predict(split.testFeatures(), context);

        List<SampleRecord> testRecords = split.testRecords();
        List<ValidatedRecord> validated = new ArrayList<>(testRecords.size());
        for (int i = 0; i < testRecords.size(); i++) {
            validated.add(new ValidatedRecord(testRecords.get(i), predicted[i]));
        }

        ValidationMetrics metrics = computeMetrics(actual, predicted);
        log.info("Validación ({} puntos): RMSE={}, MAE={}, R2={}", metrics.n(), metrics.rmse(), metrics.mae(), metrics.r2());
        return new Outcome(metrics, validated);
    }

    /**
     * R² sigue el convenio habitual cuando la varianza del objetivo es nula:
     * 1 si el ajuste es perfecto y 0 en otro caso. Con menos de dos filas no está definido (NaN).
     */
    public static ValidationMetrics computeMetrics(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("Longitudes distintas: " + actual.length + " vs " + predicted.length);
        }
        int n = actual.length;
        if (n == 0) {
            return new ValidationMetrics(Double.NaN, Double.NaN, Double.NaN, 0);
        }
        double sse = 0.0;
        double sae = 0.0;
        for (int i = 0; i < n; i++) {
            double err = actual[i] - predicted[i];
            sse += err * err;
            sae += Math.abs(err);
        }
        double rmse = Math.sqrt(sse / n);
        double mae = sae / n;

        double r2;
        if (n < 2) {
            r2 = Double.NaN;
        } else {
            double mean = StatUtils.mean(actual);
            double sst = 0.0;
            for (double a : actual) {
                sst += (a - mean) * (a - mean);
            }
            if (sst == 0.0) {
                r2 = sse == 0.0 ? 1.0 : 0.0;
            } else {
                r2 = 1.0 - sse / sst;
            }
        }
        return new ValidationMetrics(rmse, mae, r2, n);
    }

    public record Outcome(ValidationMetrics metrics, List<ValidatedRecord> validatedRecords) {
    }
}
