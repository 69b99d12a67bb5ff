package projectsdb.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura de objetos en JSON (ajustes de ejecución, informes).
 * Trabaja con cualquier tipo compatible con Jackson.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una sola instancia.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Instantes como texto ISO-8601, no como número.
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Los ajustes escritos a mano pueden llevar claves informativas.
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa {@code data} en {@code path}, sobrescribiendo el archivo si existe.
     *
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando {} a {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Reconstruye un objeto de tipo {@code objectType} desde un archivo JSON.
     *
     * @throws IOException Si el archivo no existe o hay un error de lectura o formato.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando {} a {}", path.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public String writeToString(Object data) throws IOException {
        return objectMapper.writeValueAsString(data);
    }

    public <T> T readFromString(String json, Class<T> objectType) throws IOException {
        return objectMapper.readValue(json, objectType);
    }
}
