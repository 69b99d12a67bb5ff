package projectsdb.config;

import lombok.Builder;
import projectsdb.domain.exception.ConfigurationException;

import java.util.Objects;

/**
 * Configuración completa de una ejecución tal y como se lee de disco:
 * opciones de procesamiento más la variante de método correspondiente.
 */
@Builder
public record PipelineSettings(
        ProcessingConfig processing,
        MethodConfig methodConfig
) {

    public PipelineSettings {
        Objects.requireNonNull(processing, "La configuración de procesamiento no puede ser nula.");
        Objects.requireNonNull(methodConfig, "La configuración del método no puede ser nula.");
    }

    /**
     * Comprueba que la variante de método coincide con el método seleccionado.
     */
    public void checkConsistency() {
        if (processing.getMethod() != methodConfig.method()) {
            throw new ConfigurationException("El método " + processing.getMethod()
                    + " no coincide con la configuración recibida (" + methodConfig.method() + ").");
        }
    }
}
