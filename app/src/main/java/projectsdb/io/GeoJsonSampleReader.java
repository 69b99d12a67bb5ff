package projectsdb.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import projectsdb.domain.sample.SamplePoint;
import projectsdb.domain.sample.SampleTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lee una muestra desde una FeatureCollection GeoJSON.
 * El CRS sale del miembro {@code crs} con nombre; si no existe se asume WGS84 (EPSG:4326).
 */
@Slf4j
public class GeoJsonSampleReader {

    public static final String DEFAULT_CRS = "EPSG:4326";

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PROPERTIES = new TypeReference<>() {
    };

    public SampleTable read(Path path) throws IOException {
        log.info("Leyendo muestra GeoJSON {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            JsonNode features = root.path("features");
            if (!features.isArray()) {
                throw new IOException("El archivo no es una FeatureCollection: " + path.toAbsolutePath());
            }

            GeoJsonReader geometryReader = new GeoJsonReader();
            List<SamplePoint> points = new ArrayList<>(features.size());
            int skipped = 0;
            for (JsonNode feature : features) {
                JsonNode geometryNode = feature.get("geometry");
                if (geometryNode == null || geometryNode.isNull()) {
                    skipped++;
                    continue;
                }
                Geometry geometry = geometryReader.read(geometryNode.toString());
                Map<String, Object> properties = feature.hasNonNull("properties")
                        ? objectMapper.convertValue(feature.get("properties"), PROPERTIES)
                        : Map.of();
                points.add(new SamplePoint(geometry, properties));
            }
            if (skipped > 0) {
                log.warn("{} entidades sin geometría descartadas.", skipped);
            }
            String crs = crsOf(root);
            log.info("Muestra GeoJSON cargada: {} entidades, CRS {}", points.size(), crs);
            return new SampleTable(crs, points);
        } catch (ParseException e) {
            log.error("Geometría GeoJSON inválida en {}", path.toAbsolutePath(), e);
            throw new IOException("Geometría GeoJSON inválida en " + path.toAbsolutePath(), e);
        } catch (IOException e) {
            log.error("Error al leer el GeoJSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    static String crsOf(JsonNode root) {
        String name = root.path("crs").path("properties").path("name").asText(null);
        if (name == null || name.isBlank() || name.toUpperCase().endsWith("CRS84")) {
            return DEFAULT_CRS;
        }
        return name;
    }
}
