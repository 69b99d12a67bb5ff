package projectsdb.processing.stage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsdb.SdbTestFixtures;
import projectsdb.domain.exception.ConfigurationException;
import projectsdb.domain.sample.SampleTable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GeometryNormalizerTest {

    private final GeometryNormalizer normalizer = new GeometryNormalizer();

    @Test
    @DisplayName("Con el mismo CRS la reproyección no cambia ninguna coordenada")
    void normalize_sameCrs_isNoOp() {
        SampleTable samples = SdbTestFixtures.cellSamples(5);

        SampleTable result = normalizer.normalize(samples, "epsg:32750");

        assertThat(normalizer.stageLabel(samples, "epsg:32750")).isEqualTo(GeometryNormalizer.SKIP_LABEL);
        assertThat(result.crs()).isEqualTo(samples.crs());
        for (int i = 0; i < samples.size(); i++) {
            assertThat(result.get(i).x()).isEqualTo(samples.get(i).x());
            assertThat(result.get(i).y()).isEqualTo(samples.get(i).y());
            assertThat(result.get(i).attributes()).isEqualTo(samples.get(i).attributes());
        }
    }

    @Test
    @DisplayName("Un punto en el meridiano central de la zona 50 cae en el falso este de UTM 50S")
    void normalize_differentCrs_reprojects() {
        // --- 1. Arrange ---
        SampleTable samples = SdbTestFixtures.table(SdbTestFixtures.WGS84, SdbTestFixtures.point(117.0, 0.0, -3.0));

        // --- 2. Act ---
        SampleTable result = normalizer.normalize(samples, SdbTestFixtures.UTM_50S);

        // --- 3. Assert ---
        assertThat(normalizer.stageLabel(samples, SdbTestFixtures.UTM_50S)).isEqualTo(GeometryNormalizer.REPROJECT_LABEL);
        assertThat(result.crs()).isEqualTo(SdbTestFixtures.UTM_50S);
        assertThat(result.get(0).x()).isCloseTo(500000.0, within(1e-3));
        assertThat(result.get(0).y()).isCloseTo(10000000.0, within(1e-3));
        assertThat(result.get(0).numericAttribute("z")).isEqualTo(-3.0);
        // La entrada no se modifica.
        assertThat(samples.get(0).x()).isEqualTo(117.0);
    }

    @Test
    @DisplayName("Un CRS desconocido es un error de configuración")
    void normalize_unknownCrs_throws() {
        SampleTable samples = SdbTestFixtures.table("EPSG:999999", SdbTestFixtures.point(1.0, 1.0, -1.0));

        assertThatThrownBy(() -> normalizer.normalize(samples, SdbTestFixtures.UTM_50S))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Las URN de OGC se reducen a AUTORIDAD:CÓDIGO")
    void canonicalCrs_reducesUrn() {
        assertThat(GeometryNormalizer.canonicalCrs("urn:ogc:def:crs:EPSG::32750")).isEqualTo("EPSG:32750");
        assertThat(GeometryNormalizer.canonicalCrs(" epsg:4326 ")).isEqualTo("EPSG:4326");
    }
}
