package projectsdb.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.geojson.GeoJsonWriter;
import projectsdb.domain.sample.SampleRecord;
import projectsdb.domain.sample.ValidatedRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exporta las particiones de entrenamiento y test como FeatureCollection GeoJSON de puntos 3D
 * ({@code x, y, z}) en el CRS del ráster. Las propiedades son las mismas columnas que el CSV:
 * {@code band1..bandN, z} y, en el test, {@code z_validate}.
 */
@Slf4j
public class SampleTableGeoJsonWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final GeometryFactory geometryFactory = new GeometryFactory();

    public void writeTrain(List<SampleRecord> records, List<String> bandNames, String crs, Path path) throws IOException {
        ObjectNode collection = collection(crs);
        ArrayNode features = collection.putArray("features");
        for (SampleRecord record : records) {
            features.add(feature(record, bandNames));
        }
        write(collection, records.size(), path);
    }

    public void writeTest(List<ValidatedRecord> records, List<String> bandNames, String crs, Path path) throws IOException {
        ObjectNode collection = collection(crs);
        ArrayNode features = collection.putArray("features");
        for (ValidatedRecord validated : records) {
            ObjectNode feature = feature(validated.record(), bandNames);
            ((ObjectNode) feature.get("properties")).put(SampleTableCsvWriter.VALIDATED_COLUMN, validated.validated());
            features.add(feature);
        }
        write(collection, records.size(), path);
    }

    private void write(ObjectNode collection, int count, Path path) throws IOException {
        log.info("Exportando {} puntos a {}", count, path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), collection);
        } catch (IOException e) {
            log.error("Error al exportar GeoJSON a {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private static ObjectNode collection(String crs) {
        ObjectNode collection = objectMapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        if (crs != null) {
            ObjectNode crsNode = collection.putObject("crs");
            crsNode.put("type", "name");
            crsNode.putObject("properties").put("name", crs);
        }
        return collection;
    }

    private ObjectNode feature(SampleRecord record, List<String> bandNames) throws IOException {
        GeoJsonWriter geometryWriter = new GeoJsonWriter();
        geometryWriter.setEncodeCRS(false);
        String geometry = geometryWriter.write(
                geometryFactory.createPoint(new Coordinate(record.x(), record.y(), record.depth())));

        ObjectNode feature = objectMapper.createObjectNode();
        feature.put("type", "Feature");
        feature.set("geometry", objectMapper.readTree(geometry));
        ObjectNode properties = feature.putObject("properties");
        for (int b = 0; b < bandNames.size(); b++) {
            properties.put(bandNames.get(b), record.bandValue(b));
        }
        properties.put(SampleTableCsvWriter.DEPTH_COLUMN, record.depth());
        return feature;
    }
}
