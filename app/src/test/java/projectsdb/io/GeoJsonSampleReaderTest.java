package projectsdb.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectsdb.domain.sample.SampleTable;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoJsonSampleReaderTest {

    private final GeoJsonSampleReader reader = new GeoJsonSampleReader();

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(Objects.requireNonNull(GeoJsonSampleReaderTest.class.getResource("/fixtures/" + name)).toURI());
    }

    @Test
    @DisplayName("Se leen puntos, atributos y CRS; las entidades sin geometría se descartan")
    void read_featureCollection() throws Exception {
        SampleTable table = reader.read(fixture("samples.geojson"));

        assertThat(table.crs()).isEqualTo("urn:ogc:def:crs:EPSG::32750");
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.get(0).isPoint()).isTrue();
        assertThat(table.get(0).x()).isEqualTo(500010.0);
        assertThat(table.get(0).y()).isEqualTo(9100010.0);
        assertThat(table.get(1).numericAttribute("z")).isEqualTo(-7.25);
        assertThat(table.get(1).attribute("id")).isEqualTo("b");
    }

    @Test
    @DisplayName("Sin miembro crs o con CRS84 se asume EPSG:4326")
    void crsOf_defaults() throws IOException {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(GeoJsonSampleReader.crsOf(mapper.readTree("{\"type\":\"FeatureCollection\"}")))
                .isEqualTo(GeoJsonSampleReader.DEFAULT_CRS);
        assertThat(GeoJsonSampleReader.crsOf(mapper.readTree(
                "{\"crs\":{\"type\":\"name\",\"properties\":{\"name\":\"urn:ogc:def:crs:OGC:1.3:CRS84\"}}}")))
                .isEqualTo("EPSG:4326");
    }

    @Test
    void read_rejectsNonCollection(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("point.geojson");
        Files.writeString(file, "{\"type\":\"Point\",\"coordinates\":[1,2]}");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("FeatureCollection");
    }
}
