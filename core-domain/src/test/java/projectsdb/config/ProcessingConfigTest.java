package projectsdb.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsdb.domain.event.FailureReason;
import projectsdb.domain.exception.ConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Pruebas de {@link ProcessingConfig}: valores por defecto, corrección de la ventana y validación.
 */
class ProcessingConfigTest {

    private ProcessingConfig base() {
        return ProcessingConfig.builder().depthLabel("z").build();
    }

    @Test
    @DisplayName("Los valores por defecto coinciden con los del programa de escritorio")
    void defaults_matchDesktopProgram() {
        ProcessingConfig config = base();

        assertThat(config.getTrainFraction()).isEqualTo(0.75);
        assertThat(config.isLimitEnabled()).isTrue();
        assertThat(config.getLimitUpper()).isEqualTo(0.0);
        assertThat(config.getLimitLower()).isEqualTo(-30.0);
        assertThat(config.getMethod()).isEqualTo(RegressionMethod.KNN);
        assertThat(config.isAutoNegativeSign()).isTrue();
        assertThat(config.isExcludeOutOfBounds()).isTrue();
        assertThat(config.getMissingBandFill()).isEqualTo(-999.0);
        assertThat(config.getParallelism()).isEqualTo(ParallelismConfig.defaults());
    }

    @Test
    @DisplayName("Una ventana invertida se intercambia: limitUpper >= limitLower")
    void normalized_swapsInvertedWindow() {
        // --- 1. Arrange ---
        ProcessingConfig inverted = base().withLimitUpper(-30.0).withLimitLower(0.0);

        // --- 2. Act ---
        ProcessingConfig normalized = inverted.normalized();

        // --- 3. Assert ---
        assertThat(normalized.getLimitUpper()).isEqualTo(0.0);
        assertThat(normalized.getLimitLower()).isEqualTo(-30.0);
        assertThat(normalized.getLimitUpper()).isGreaterThanOrEqualTo(normalized.getLimitLower());
        // La instancia original no cambia.
        assertThat(inverted.getLimitUpper()).isEqualTo(-30.0);
    }

    @Test
    @DisplayName("Una ventana ya ordenada devuelve la misma instancia")
    void normalized_keepsOrderedWindow() {
        ProcessingConfig config = base();
        assertSame(config, config.normalized());
    }

    @Test
    @DisplayName("Un número de núcleos igual a cero se rechaza")
    void validate_rejectsZeroWorkers() {
        ProcessingConfig config = base().withParallelism(new ParallelismConfig(ParallelismConfig.Backend.THREAD_POOL, 0, 0L));

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasFieldOrPropertyWithValue("reason", FailureReason.CONFIGURATION);
    }

    @Test
    @DisplayName("Cero núcleos se rechaza también con el backend secuencial")
    void validate_rejectsZeroWorkersWhenSequential() {
        ProcessingConfig config = base().withParallelism(new ParallelismConfig(ParallelismConfig.Backend.SEQUENTIAL, 0, 0L));

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("cero");
    }

    @Test
    @DisplayName("La fracción de entrenamiento debe estar en el intervalo abierto (0, 1)")
    void validate_rejectsFractionOutsideOpenInterval() {
        assertThatThrownBy(() -> base().withTrainFraction(1.0).validate()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> base().withTrainFraction(0.0).validate()).isInstanceOf(ConfigurationException.class);
        assertDoesNotThrow(() -> base().withTrainFraction(0.5).validate());
    }

    @Test
    @DisplayName("Sin columna de profundidad la configuración no es válida")
    void validate_rejectsBlankDepthLabel() {
        assertThatThrownBy(() -> base().withDepthLabel(" ").validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("profundidad");
    }
}
