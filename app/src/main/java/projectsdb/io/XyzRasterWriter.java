package projectsdb.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import projectsdb.domain.prediction.PredictionResult;
import projectsdb.domain.raster.GeoTransform;
import projectsdb.processing.postprocess.MedianFilter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Escribe la predicción como rejilla ASCII XYZ: una línea {@code x y z} por píxel,
 * en el centro de la celda y en orden de fila. Los píxeles enmascarados se escriben como {@code NaN}
 * para que la rejilla siga siendo regular.
 */
@Slf4j
public class XyzRasterWriter {

    private static final CsvMapper csvMapper = new CsvMapper();
    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("x", CsvSchema.ColumnType.NUMBER)
            .addColumn("y", CsvSchema.ColumnType.NUMBER)
            .addColumn("z", CsvSchema.ColumnType.NUMBER)
            .setColumnSeparator(' ')
            .setUseHeader(false)
            .build();

    private final MedianFilter medianFilter;

    public XyzRasterWriter() {
        this(new MedianFilter(0));
    }

    public XyzRasterWriter(MedianFilter medianFilter) {
        this.medianFilter = medianFilter;
    }

    public void write(PredictionResult result, Path path) throws IOException {
        double[] values = medianFilter.apply(result.getPredictedDepth(), result.getWidth(), result.getHeight());
        write(values, result.getWidth(), result.getHeight(), result.getTransform(), path);
    }

    public void write(double[] values, int width, int height, GeoTransform transform, Path path) throws IOException {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Se esperaban " + (width * height) + " píxeles y hay " + values.length);
        }
        log.info("Escribiendo rejilla XYZ {}x{} en {}", width, height, path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (SequenceWriter writer = csvMapper.writer(SCHEMA).writeValues(path.toFile())) {
                for (int row = 0; row < height; row++) {
                    for (int col = 0; col < width; col++) {
                        double[] centre = transform.toGeographic(col + 0.5, row + 0.5);
                        Map<String, Object> line = new LinkedHashMap<>();
                        line.put("x", centre[0]);
                        line.put("y", centre[1]);
                        line.put("z", values[row * width + col]);
                        writer.write(line);
                    }
                }
            }
        } catch (IOException e) {
            log.error("Error al escribir la rejilla XYZ {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
