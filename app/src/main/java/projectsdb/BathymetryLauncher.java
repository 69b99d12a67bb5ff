package projectsdb;

import lombok.extern.slf4j.Slf4j;
import projectsdb.config.PipelineSettings;
import projectsdb.domain.event.ProgressEvent;
import projectsdb.domain.exception.SdbProcessingException;
import projectsdb.domain.prediction.PredictionResult;
import projectsdb.domain.raster.RasterImage;
import projectsdb.domain.sample.SampleTable;
import projectsdb.io.CsvSampleReader;
import projectsdb.io.GeoJsonSampleReader;
import projectsdb.io.GeoTiffRasterReader;
import projectsdb.io.GeoTiffRasterWriter;
import projectsdb.io.JsonFileHandler;
import projectsdb.io.RunReportFactory;
import projectsdb.io.SampleTableCsvWriter;
import projectsdb.io.SampleTableGeoJsonWriter;
import projectsdb.io.XyzRasterWriter;
import projectsdb.processing.i.IPipelineListener;
import projectsdb.processing.pipeline.BathymetryPipeline;
import projectsdb.processing.pipeline.PipelineRequest;
import projectsdb.processing.pipeline.PipelineRunner;
import projectsdb.processing.postprocess.MedianFilter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Punto de entrada por línea de comandos.
 * <p>
 * Argumentos con el formato {@code --clave=valor}:
 * <ul>
 *   <li>{@code --raster} GeoTIFF multibanda (obligatorio).</li>
 *   <li>{@code --samples} muestra en CSV o GeoJSON (obligatorio).</li>
 *   <li>{@code --settings} JSON con {@link PipelineSettings} (obligatorio).</li>
 *   <li>{@code --out} directorio de salida (por defecto {@code ./sdb-output}).</li>
 *   <li>{@code --x}, {@code --y}, {@code --samples-crs} columnas y CRS de una muestra CSV.</li>
 *   <li>{@code --median} lado del filtro de mediana de la predicción exportada (0 = sin filtro).</li>
 *   <li>{@code --format} formato de la predicción: {@code gtiff} (por defecto) o {@code xyz}.</li>
 * </ul>
 */
@Slf4j
public class BathymetryLauncher {

    public static void main(String[] args) {
        try {
            run(parseArgs(args));
        } catch (IllegalArgumentException e) {
            log.error(">>> Argumentos inválidos: {}", e.getMessage());
            System.exit(2);
        } catch (IOException e) {
            log.error(">>> Error de entrada/salida.", e);
            System.exit(1);
        } catch (SdbProcessingException e) {
            log.error(">>> La ejecución ha fallado ({}): {}", e.getReason(), e.getMessage());
            System.exit(1);
        }
    }

    static void run(Map<String, String> options) throws IOException {
        Path rasterPath = Path.of(required(options, "raster"));
        Path samplesPath = Path.of(required(options, "samples"));
        Path settingsPath = Path.of(required(options, "settings"));
        Path outDir = Path.of(options.getOrDefault("out", "sdb-output"));
        int medianSize = Integer.parseInt(options.getOrDefault("median", "0"));
        String format = options.getOrDefault("format", "gtiff").toLowerCase(Locale.ROOT);
        if (!format.equals("gtiff") && !format.equals("xyz")) {
            throw new IllegalArgumentException("Formato de salida no soportado: " + format + " (gtiff | xyz)");
        }

        // --- 1. ENTRADAS ---
        JsonFileHandler json = new JsonFileHandler();
        PipelineSettings settings = json.readFromFile(settingsPath, PipelineSettings.class);
        RasterImage raster = new GeoTiffRasterReader().read(rasterPath);
        SampleTable samples = readSamples(samplesPath, options);

        // --- 2. EJECUCIÓN ---
        PredictionResult result;
        try (PipelineRunner runner = new PipelineRunner(new BathymetryPipeline())) {
            result = runner.submit(PipelineRequest.of(settings, raster, samples), new IPipelineListener() {
                @Override
                public void onProgress(ProgressEvent event) {
                    log.info(">>> {} {}", event.timestamp(), event.label());
                }
            }).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }

        // --- 3. EXPORTACIÓN ---
        MedianFilter medianFilter = new MedianFilter(medianSize);
        Map<String, String> outputs = new LinkedHashMap<>();
        if (format.equals("xyz")) {
            Path prediction = outDir.resolve("prediction.xyz");
            new XyzRasterWriter(medianFilter).write(result, prediction);
            outputs.put("prediction", prediction.getFileName().toString());
        } else {
            Path prediction = outDir.resolve("prediction.tif");
            new GeoTiffRasterWriter(medianFilter).write(result, prediction);
            outputs.put("prediction", prediction.getFileName().toString());
        }

        List<String> bandNames = result.getSampledDataset().bandNames();
        SampleTableCsvWriter tables = new SampleTableCsvWriter();
        tables.writeTrain(result.getTrainRecords(), bandNames, outDir.resolve("train.csv"));
        tables.writeTest(result.getTestRecords(), bandNames, outDir.resolve("test.csv"));
        outputs.put("train", "train.csv");
        outputs.put("test", "test.csv");

        SampleTableGeoJsonWriter points = new SampleTableGeoJsonWriter();
        points.writeTrain(result.getTrainRecords(), bandNames, result.getCrs(), outDir.resolve("train.geojson"));
        points.writeTest(result.getTestRecords(), bandNames, result.getCrs(), outDir.resolve("test.geojson"));
        outputs.put("trainPoints", "train.geojson");
        outputs.put("testPoints", "test.geojson");
        outputs.put("report", "report.json");

        json.writeToFile(RunReportFactory.create(result, rasterPath.toString(), samplesPath.toString(), medianFilter, outputs),
                outDir.resolve("report.json"));
        log.info(">>> Resultados escritos en {}", outDir.toAbsolutePath());
    }

    private static SampleTable readSamples(Path path, Map<String, String> options) throws IOException {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            CsvSampleReader reader = new CsvSampleReader(options.getOrDefault("x", "x"), options.getOrDefault("y", "y"));
            return reader.read(path, required(options, "samples-crs"));
        }
        return new GeoJsonSampleReader().read(path);
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (String arg : args) {
            if (!arg.startsWith("--") || !arg.contains("=")) {
                throw new IllegalArgumentException("Formato esperado --clave=valor: " + arg);
            }
            int eq = arg.indexOf('=');
            options.put(arg.substring(2, eq), arg.substring(eq + 1));
        }
        return options;
    }

    private static String required(Map<String, String> options, String key) {
        String value = options.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Falta el argumento obligatorio --" + key);
        }
        return value;
    }
}
