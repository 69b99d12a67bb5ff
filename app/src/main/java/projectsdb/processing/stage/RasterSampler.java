package projectsdb.processing.stage;

import lombok.extern.slf4j.Slf4j;
import projectsdb.domain.exception.OutOfBoundsException;
import projectsdb.domain.raster.RasterImage;
import projectsdb.domain.sample.SamplePoint;
import projectsdb.domain.sample.SampleRecord;
import projectsdb.domain.sample.SampleTable;
import projectsdb.domain.sample.SampledDataset;
import projectsdb.processing.i.IProcessingComponent;
import projectsdb.processing.parallel.ParallelContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Extrae el valor de cada banda del ráster en la posición de cada punto de la muestra.
 * <p>
 * La coordenada se convierte a índice de celda con la inversa de la transformación afín
 * (suelo de la columna y fila fraccionarias). Los puntos fuera de la rejilla se descartan;
 * las filas con alguna banda o profundidad ausente se eliminan tras el ensamblado.
 */
@Slf4j
public class RasterSampler implements IProcessingComponent {

    public static final String STAGE_LABEL = "Point Sampling...";

    @Override
    public String getName() {
        return "Raster Sampler";
    }

    /**
     * @throws OutOfBoundsException si ningún punto cae dentro de la rejilla del ráster.
     */
    public SampledDataset sample(SampleTable samples, RasterImage raster, String depthLabel, ParallelContext context) {
        List<Callable<List<SampleRecord>>> tasks = new ArrayList<>();
        for (int[] range : context.chunks(samples.size())) {
            final int from = range[0];
            final int to = range[1];
            tasks.add(() -> sampleRange(samples, raster, depthLabel, from, to));
        }

        List<SampleRecord> assembled = new ArrayList<>(samples.size());
        for (List<SampleRecord> chunk : context.invokeAll(tasks)) {
            assembled.addAll(chunk);
        }

        int outside = samples.size() - assembled.size();
        if (assembled.isEmpty()) {
            throw new OutOfBoundsException("Depth sample is out of image boundary: ninguno de los "
                    + samples.size() + " puntos cae dentro de la rejilla " + raster.getHeight() + " x " + raster.getWidth());
        }
        if (outside > 0) {
            log.warn("{} puntos fuera de la rejilla del ráster descartados durante el muestreo.", outside);
        }

        List<SampleRecord> complete = new ArrayList<>(assembled.size());
        for (SampleRecord record : assembled) {
            if (!record.hasMissingValue()) {
                complete.add(record);
            }
        }
        if (complete.size() < assembled.size()) {
            log.info("Eliminadas {} filas con valores ausentes.", assembled.size() - complete.size());
        }
        log.debug("Muestreo completado: {} filas, {} bandas.", complete.size(), raster.getBandCount());
        return new SampledDataset(raster.getBandNames(), complete);
    }

    private List<SampleRecord> sampleRange(SampleTable samples, RasterImage raster, String depthLabel, int from, int to) {
        List<SampleRecord> records = new ArrayList<>(to - from);
        int bandCount = raster.getBandCount();
        for (int i = from; i < to; i++) {
            SamplePoint point = samples.get(i);
            double x = point.x();
            double y = point.y();
            int[] cell = cellIndex(raster, x, y);
            if (cell == null) {
                continue;
            }
            double[] values = new double[bandCount];
            for (int b = 0; b < bandCount; b++) {
                double v = raster.getValue(b, cell[0], cell[1]);
                values[b] = raster.isMissing(v) ? Double.NaN : v;
            }
            records.add(new SampleRecord(values, x, y, point.numericAttribute(depthLabel)));
        }
        return records;
    }

    /**
     * Índice (fila, columna) de la celda que contiene la coordenada, o {@code null} si cae fuera.
     */
    static int[] cellIndex(RasterImage raster, double x, double y) {
        double[] pixel = raster.getTransform().toPixel(x, y);
        int col = (int) Math.floor(pixel[0]);
        int row = (int) Math.floor(pixel[1]);
        if (row < 0 || row >= raster.getHeight() || col < 0 || col >= raster.getWidth()) {
            return null;
        }
        return new int[]{row, col};
    }
}
