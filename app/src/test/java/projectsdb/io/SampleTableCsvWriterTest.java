package projectsdb.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectsdb.domain.sample.SampleRecord;
import projectsdb.domain.sample.ValidatedRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SampleTableCsvWriterTest {

    private final SampleTableCsvWriter writer = new SampleTableCsvWriter();
    private final List<String> bands = List.of("band1", "band2");

    @Test
    @DisplayName("La partición de entrenamiento lleva bandas, coordenadas y profundidad")
    void writeTrain_columns(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("train.csv");

        writer.writeTrain(List.of(
                new SampleRecord(new double[]{0.25, 3.0}, 500005.0, 9100035.0, -4.5),
                new SampleRecord(new double[]{0.5, 4.0}, 500015.0, 9100035.0, -6.0)), bands, file);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("band1,band2,x,y,z");
        assertThat(lines.get(1).split(",")).hasSize(5).startsWith("0.25", "3.0");
        assertThat(lines.get(2)).endsWith("-6.0");
    }

    @Test
    @DisplayName("La partición de test añade la columna z_validate")
    void writeTest_addsValidatedColumn(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("sub/test.csv");
        SampleRecord record = new SampleRecord(new double[]{1.0, 2.0}, 10.0, 20.0, -3.0);

        writer.writeTest(List.of(new ValidatedRecord(record, -2.5)), bands, file);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines.get(0)).isEqualTo("band1,band2,x,y,z,z_validate");
        assertThat(lines.get(1).split(",")).hasSize(6);
        assertThat(lines.get(1)).endsWith("-3.0,-2.5");
    }
}
