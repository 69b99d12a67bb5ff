package projectsdb.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import projectsdb.domain.exception.ConfigurationException;

/**
 * Contenedor inmutable con todas las opciones de procesamiento de una ejecución del pipeline.
 * Sustituye a los diccionarios globales de opciones: cada ejecución recibe su propia copia.
 */
@Value
@Builder
@With
@Jacksonized
public class ProcessingConfig {

    /**
     * Nombre del atributo de la muestra que contiene la profundidad.
     */
    String depthLabel;

    /**
     * Fracción de la muestra usada para entrenar, en el intervalo abierto (0, 1).
     */
    @Builder.Default
    double trainFraction = 0.75;

    /**
     * Si está activo, solo se conservan profundidades dentro de [limitLower, limitUpper]
     * y la predicción completa se enmascara fuera de esa ventana.
     */
    @Builder.Default
    boolean limitEnabled = true;

    @Builder.Default
    double limitUpper = 0.0;

    @Builder.Default
    double limitLower = -30.0;

    @Builder.Default
    RegressionMethod method = RegressionMethod.KNN;

    @Builder.Default
    ParallelismConfig parallelism = ParallelismConfig.defaults();

    /**
     * Niega la columna de profundidad cuando su mediana es positiva.
     */
    @Builder.Default
    boolean autoNegativeSign = true;

    /**
     * Descarta los puntos fuera de los límites del ráster antes del muestreo.
     */
    @Builder.Default
    boolean excludeOutOfBounds = true;

    /**
     * Valor que sustituye a los NaN de las bandas antes de predecir la imagen completa.
     */
    @Builder.Default
    double missingBandFill = -999.0;

    /**
     * Devuelve una copia con la ventana de límites ordenada ({@code limitUpper >= limitLower}).
     * Si ya está ordenada devuelve la misma instancia.
     */
    public ProcessingConfig normalized() {
        if (limitUpper >= limitLower) {
            return this;
        }
        return this.withLimitUpper(limitLower).withLimitLower(limitUpper);
    }

    /**
     * Comprueba los parámetros que no admiten corrección automática.
     *
     * @throws ConfigurationException si algún parámetro es inválido.
     */
    public void validate() {
        if (depthLabel == null || depthLabel.isBlank()) {
            throw new ConfigurationException("No se ha indicado la columna de profundidad.");
        }
        if (!(trainFraction > 0.0 && trainFraction < 1.0)) {
            throw new ConfigurationException("La fracción de entrenamiento debe estar en (0, 1): " + trainFraction);
        }
        if (method == null) {
            throw new ConfigurationException("No se ha seleccionado ningún método de regresión.");
        }
        if (parallelism == null) {
            throw new ConfigurationException("Falta la configuración de paralelismo.");
        }
        if (parallelism.workerCount() == 0) {
            throw new ConfigurationException("El número de núcleos de procesamiento no puede ser cero.");
        }
        if (Double.isNaN(limitUpper) || Double.isNaN(limitLower)) {
            throw new ConfigurationException("La ventana de profundidad contiene NaN.");
        }
    }
}
