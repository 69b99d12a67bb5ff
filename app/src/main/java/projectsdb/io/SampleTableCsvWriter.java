package projectsdb.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import projectsdb.domain.sample.SampleRecord;
import projectsdb.domain.sample.ValidatedRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exporta las particiones de entrenamiento y test a CSV.
 * Columnas: {@code band1..bandN, x, y, z} y, en el test, {@code z_validate} con la predicción.
 */
@Slf4j
public class SampleTableCsvWriter {

    public static final String DEPTH_COLUMN = "z";
    public static final String VALIDATED_COLUMN = "z_validate";

    private static final CsvMapper csvMapper = new CsvMapper();

    public void writeTrain(List<SampleRecord> records, List<String> bandNames, Path path) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (SampleRecord record : records) {
            rows.add(row(record, bandNames));
        }
        write(rows, columns(bandNames, false), path);
    }

    public void writeTest(List<ValidatedRecord> records, List<String> bandNames, Path path) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (ValidatedRecord validated : records) {
            Map<String, Object> row = row(validated.record(), bandNames);
            row.put(VALIDATED_COLUMN, validated.validated());
            rows.add(row);
        }
        write(rows, columns(bandNames, true), path);
    }

    private void write(List<Map<String, Object>> rows, CsvSchema schema, Path path) throws IOException {
        log.info("Exportando {} filas a {}", rows.size(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (SequenceWriter writer = csvMapper.writer(schema).writeValues(path.toFile())) {
                writer.writeAll(rows);
            }
        } catch (IOException e) {
            log.error("Error al exportar CSV a {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private static Map<String, Object> row(SampleRecord record, List<String> bandNames) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int b = 0; b < bandNames.size(); b++) {
            row.put(bandNames.get(b), record.bandValue(b));
        }
        row.put("x", record.x());
        row.put("y", record.y());
        row.put(DEPTH_COLUMN, record.depth());
        return row;
    }

    private static CsvSchema columns(List<String> bandNames, boolean validated) {
        CsvSchema.Builder builder = CsvSchema.builder();
        bandNames.forEach(name -> builder.addColumn(name, CsvSchema.ColumnType.NUMBER));
        builder.addColumn("x", CsvSchema.ColumnType.NUMBER);
        builder.addColumn("y", CsvSchema.ColumnType.NUMBER);
        builder.addColumn(DEPTH_COLUMN, CsvSchema.ColumnType.NUMBER);
        if (validated) {
            builder.addColumn(VALIDATED_COLUMN, CsvSchema.ColumnType.NUMBER);
        }
        return builder.setUseHeader(true).build();
    }
}
