package projectsdb.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectsdb.domain.raster.GeoTransform;
import projectsdb.domain.raster.RasterImage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GeoTiffRasterRoundTripTest {

    private final GeoTiffRasterWriter writer = new GeoTiffRasterWriter();
    private final GeoTiffRasterReader reader = new GeoTiffRasterReader();

    @Test
    @DisplayName("La predicción escrita conserva tamaño, georreferencia, CRS y NaN")
    void writeThenRead_projected(@TempDir Path tempDir) throws IOException {
        // --- 1. Arrange ---
        double[] values = {-1.5, -2.25, Double.NaN, -4.0, -5.5, -6.75};
        GeoTransform transform = GeoTransform.northUp(500000.0, 9100040.0, 10.0, 10.0);
        Path file = tempDir.resolve("out/prediction.tif");

        // --- 2. Act ---
        writer.write(values, 3, 2, transform, "EPSG:32750", file);
        RasterImage image = reader.read(file);

        // --- 3. Assert ---
        assertThat(Files.exists(file)).isTrue();
        assertThat(image.getWidth()).isEqualTo(3);
        assertThat(image.getHeight()).isEqualTo(2);
        assertThat(image.getBandCount()).isEqualTo(1);
        assertThat(image.getCrs()).isEqualTo("EPSG:32750");
        assertThat(image.getTransform().c()).isCloseTo(500000.0, within(1e-6));
        assertThat(image.getTransform().f()).isCloseTo(9100040.0, within(1e-6));
        assertThat(image.getTransform().pixelSize()).containsExactly(10.0, 10.0);
        assertThat(image.getValue(0, 0, 1)).isCloseTo(-2.25, within(1e-6));
        assertThat(image.getValue(0, 1, 2)).isCloseTo(-6.75, within(1e-6));
        assertThat(image.getValue(0, 0, 2)).isNaN();
    }

    @Test
    @DisplayName("Los píxeles enmascarados quedan declarados como nodata")
    void writeThenRead_declaresNanNodata(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("masked.tif");

        writer.write(new double[]{Double.NaN, -3.0, -4.0, Double.NaN}, 2, 2,
                GeoTransform.northUp(500000.0, 9100040.0, 10.0, 10.0), "EPSG:32750", file);
        RasterImage image = reader.read(file);

        assertThat(image.getNodata()).isNotNull().isNaN();
        assertThat(image.isMissing(image.getValue(0, 0, 0))).isTrue();
        assertThat(image.isMissing(image.getValue(0, 0, 1))).isFalse();
    }

    @Test
    @DisplayName("Un CRS geográfico se escribe con su clave de tipo geográfico")
    void writeThenRead_geographic(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("geo.tif");

        writer.write(new double[]{1, 2, 3, 4}, 2, 2, GeoTransform.northUp(115.0, -8.0, 0.001, 0.001), "EPSG:4326", file);

        assertThat(reader.read(file).getCrs()).isEqualTo("EPSG:4326");
    }

    @Test
    void epsgCode_parsesCanonicalForms() {
        assertThat(GeoTiffRasterWriter.epsgCode("epsg:32750")).isEqualTo(32750);
        assertThat(GeoTiffRasterWriter.epsgCode("urn:ogc:def:crs:EPSG::4326")).isEqualTo(4326);
        assertThat(GeoTiffRasterWriter.epsgCode("+proj=longlat")).isNull();
        assertThat(GeoTiffRasterWriter.epsgCode(null)).isNull();
    }

    @Test
    void read_missingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("none.tif"))).isInstanceOf(IOException.class);
    }
}
