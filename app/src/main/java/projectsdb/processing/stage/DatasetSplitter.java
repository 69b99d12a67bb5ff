package projectsdb.processing.stage;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.util.MathArrays;
import projectsdb.domain.exception.InsufficientSamplesException;
import projectsdb.domain.sample.SampleRecord;
import projectsdb.domain.sample.SampledDataset;
import projectsdb.domain.sample.SplitResult;
import projectsdb.processing.i.IProcessingComponent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Partición aleatoria (sin estratificar) en entrenamiento y test, reproducible por semilla.
 * <p>
 * {@code nTrain = floor(fraction * n)} y el resto va a test. Tras barajar los índices,
 * los primeros {@code nTest} forman el test y los siguientes el entrenamiento.
 */
@Slf4j
public class DatasetSplitter implements IProcessingComponent {

    @Override
    public String getName() {
        return "Splitter";
    }

    public SplitResult split(SampledDataset dataset, double trainFraction, long seed) {
        int n = dataset.size();
        int nTrain = (int) Math.floor(trainFraction * n);
        int nTest = n - nTrain;
        if (nTrain < 1 || nTest < 1) {
            throw new InsufficientSamplesException("No hay muestras suficientes para entrenar y validar: "
                    + n + " filas con fracción de entrenamiento " + trainFraction);
        }

        int[] order = IntStream.range(0, n).toArray();
        MathArrays.shuffle(order, new MersenneTwister(seed));

        List<SampleRecord> records = dataset.records();
        List<SampleRecord> test = new ArrayList<>(nTest);
        List<SampleRecord> train = new ArrayList<>(nTrain);
        for (int i = 0; i < nTest; i++) {
            test.add(records.get(order[i]));
        }
        for (int i = nTest; i < n; i++) {
            train.add(records.get(order[i]));
        }
        log.info("Partición: {} filas de entrenamiento, {} de test (semilla {}).", nTrain, nTest, seed);
        return new SplitResult(train, test);
    }
}
