package projectsdb.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Parámetros específicos de un algoritmo de regresión.
 * <p>
 * Hay exactamente una variante por {@link RegressionMethod}; la que se usa en una ejecución
 * debe coincidir con {@link ProcessingConfig#getMethod()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "method")
@JsonSubTypes({
        @JsonSubTypes.Type(value = KnnConfig.class, name = "KNN"),
        @JsonSubTypes.Type(value = MlrConfig.class, name = "MLR"),
        @JsonSubTypes.Type(value = RandomForestConfig.class, name = "RF"),
        @JsonSubTypes.Type(value = SvmConfig.class, name = "SVM")
})
public interface MethodConfig {

    @JsonIgnore
    RegressionMethod method();

    /**
     * Valida los parámetros antes de construir el estimador.
     *
     * @throws projectsdb.domain.exception.ConfigurationException si la combinación no es válida.
     */
    void validate();
}
