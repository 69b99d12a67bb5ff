package projectsdb.domain.raster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterImageTest {

    private RasterImage twoByThree(Double nodata) {
        double[][] bands = {
                {1, 2, 3, 4, 5, Double.NaN},
                {10, 20, 30, 40, 50, 60}
        };
        return new RasterImage(3, 2, bands, GeoTransform.northUp(100.0, 50.0, 1.0, 1.0), "EPSG:32750", nodata);
    }

    @Test
    @DisplayName("Los valores se leen en orden de fila")
    void getValue_rowMajor() {
        RasterImage raster = twoByThree(null);

        assertThat(raster.getValue(0, 0, 2)).isEqualTo(3.0);
        assertThat(raster.getValue(1, 1, 0)).isEqualTo(40.0);
        assertThat(raster.getBandNames()).containsExactly("band1", "band2");
    }

    @Test
    @DisplayName("La caja envolvente cubre la rejilla completa")
    void getBounds_coversGrid() {
        RasterBounds bounds = twoByThree(null).getBounds();

        assertThat(bounds).isEqualTo(new RasterBounds(100.0, 48.0, 103.0, 50.0));
        assertThat(bounds.strictlyContains(101.0, 49.0)).isTrue();
        assertThat(bounds.strictlyContains(100.0, 49.0)).isFalse();
    }

    @Test
    @DisplayName("La matriz de predicción sustituye los NaN por el valor de relleno")
    void toFeatureMatrix_fillsNaN() {
        double[][] features = twoByThree(null).toFeatureMatrix(-999.0);

        assertThat(features).hasNumberOfRows(6);
        assertThat(features[5]).containsExactly(-999.0, 60.0);
        assertThat(features[0]).containsExactly(1.0, 10.0);
    }

    @Test
    @DisplayName("El centinela nodata cuenta como valor ausente")
    void isMissing_honoursNodata() {
        RasterImage raster = twoByThree(0.0);

        assertThat(raster.isMissing(0.0)).isTrue();
        assertThat(raster.isMissing(Double.NaN)).isTrue();
        assertThat(raster.isMissing(1.0)).isFalse();
    }

    @Test
    @DisplayName("La imagen no comparte los arrays del llamador")
    void constructor_copiesBands() {
        double[][] bands = {{1, 2, 3, 4}};
        RasterImage raster = new RasterImage(2, 2, bands, GeoTransform.northUp(0, 0, 1, 1), "EPSG:4326", null);

        bands[0][0] = 99.0;

        assertThat(raster.getValue(0, 0, 0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Una banda con un número de píxeles incorrecto se rechaza")
    void constructor_rejectsWrongBandLength() {
        assertThatThrownBy(() -> new RasterImage(2, 2, new double[][]{{1, 2, 3}}, GeoTransform.northUp(0, 0, 1, 1), "EPSG:4326", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
