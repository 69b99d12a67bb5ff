package projectsdb.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import projectsdb.domain.sample.SamplePoint;
import projectsdb.domain.sample.SampleTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lee una muestra de profundidades desde un CSV con cabecera.
 * <p>
 * Dos columnas dan las coordenadas del punto; el resto pasan a ser atributos
 * (numéricos si se pueden interpretar como número, texto en otro caso, nulos si están vacíos).
 * El CSV no lleva CRS, así que lo indica el llamador.
 */
@Slf4j
public class CsvSampleReader {

    private static final CsvMapper csvMapper = new CsvMapper();

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final String xColumn;
    private final String yColumn;

    public CsvSampleReader(String xColumn, String yColumn) {
        this.xColumn = xColumn;
        this.yColumn = yColumn;
    }

    public SampleTable read(Path path, String crs) throws IOException {
        log.info("Leyendo muestra CSV {} (x={}, y={}, CRS {})", path.toAbsolutePath(), xColumn, yColumn, crs);
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<SamplePoint> points = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema).readValues(path.toFile())) {
            int line = 1;
            while (rows.hasNext()) {
                line++;
                Map<String, String> row = rows.next();
                double x = coordinate(row, xColumn, line);
                double y = coordinate(row, yColumn, line);

                Map<String, Object> attributes = new LinkedHashMap<>();
                for (Map.Entry<String, String> cell : row.entrySet()) {
                    if (!cell.getKey().equals(xColumn) && !cell.getKey().equals(yColumn)) {
                        attributes.put(cell.getKey(), parse(cell.getValue()));
                    }
                }
                points.add(new SamplePoint(geometryFactory.createPoint(new Coordinate(x, y)), attributes));
            }
        } catch (IOException e) {
            log.error("Error al leer el CSV {}", path.toAbsolutePath(), e);
            throw e;
        }
        log.info("Muestra CSV cargada: {} puntos.", points.size());
        return new SampleTable(crs, points);
    }

    private static double coordinate(Map<String, String> row, String column, int line) throws IOException {
        Object value = parse(row.get(column));
        if (!(value instanceof Double number)) {
            throw new IOException("Línea " + line + ": la columna de coordenadas '" + column + "' falta o no es numérica.");
        }
        return number;
    }

    static Object parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return raw;
        }
    }
}
