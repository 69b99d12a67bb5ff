package projectsdb.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectsdb.domain.prediction.PredictionResult;
import projectsdb.domain.raster.GeoTransform;
import projectsdb.processing.postprocess.MedianFilter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XyzRasterWriterTest {

    private final GeoTransform transform = GeoTransform.northUp(500000.0, 9100040.0, 10.0, 10.0);

    @Test
    @DisplayName("Una línea x y z por píxel, en el centro de la celda y en orden de fila")
    void write_pixelCentres(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("grid/prediction.xyz");

        new XyzRasterWriter().write(new double[]{-1.5, -2.0, Double.NaN, -4.25}, 2, 2, transform, file);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).containsExactly(
                "500005.0 9100035.0 -1.5",
                "500015.0 9100035.0 -2.0",
                "500005.0 9100025.0 NaN",
                "500015.0 9100025.0 -4.25");
    }

    @Test
    @DisplayName("El filtro de mediana se aplica antes de escribir")
    void write_appliesMedianFilter(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("smooth.xyz");
        PredictionResult result = PredictionResult.builder()
                .predictedDepth(new double[]{1, 1, 1, 1, 50, 1, 1, 1, 1})
                .width(3)
                .height(3)
                .transform(GeoTransform.northUp(0.0, 30.0, 10.0, 10.0))
                .build();

        new XyzRasterWriter(new MedianFilter(3)).write(result, file);

        assertThat(Files.readAllLines(file).get(4)).isEqualTo("15.0 15.0 1.0");
    }

    @Test
    void write_rejectsWrongSize(@TempDir Path tempDir) {
        assertThatThrownBy(() -> new XyzRasterWriter().write(new double[3], 2, 2, transform, tempDir.resolve("x.xyz")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
