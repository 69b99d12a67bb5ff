package projectsdb.factory;

import lombok.extern.slf4j.Slf4j;
import projectsdb.config.KnnConfig;
import projectsdb.config.MethodConfig;
import projectsdb.config.MlrConfig;
import projectsdb.config.RandomForestConfig;
import projectsdb.config.RegressionMethod;
import projectsdb.config.SvmConfig;
import projectsdb.domain.exception.ConfigurationException;
import projectsdb.processing.i.IRegressor;
import projectsdb.processing.regressor.KnnRegressor;
import projectsdb.processing.regressor.LinearRegressor;
import projectsdb.processing.regressor.RandomForestRegressor;
import projectsdb.processing.regressor.SupportVectorRegressor;

/**
 * Construye el estimador que corresponde al método seleccionado.
 * El pipeline solo conoce {@link IRegressor}; esta fábrica es el único punto que conoce las implementaciones.
 */
@Slf4j
public class RegressorFactory {

    /**
     * @param method Método seleccionado en la configuración de la ejecución.
     * @param config Parámetros del método. Deben corresponder a {@code method}.
     * @return Un estimador sin ajustar.
     * @throws ConfigurationException si faltan parámetros, no son válidos o no corresponden al método.
     */
    public IRegressor create(RegressionMethod method, MethodConfig config) {
        if (method == null || config == null) {
            throw new ConfigurationException("Se requieren el método de regresión y sus parámetros.");
        }
        if (config.method() != method) {
            throw new ConfigurationException("Los parámetros recibidos son de " + config.method()
                    + " pero el método seleccionado es " + method);
        }
        config.validate();

        IRegressor regressor = switch (method) {
            case KNN -> new KnnRegressor((KnnConfig) config);
            case MLR -> new LinearRegressor((MlrConfig) config);
            case RF -> new RandomForestRegressor((RandomForestConfig) config);
            case SVM -> new SupportVectorRegressor((SvmConfig) config);
        };
        log.info("Estimador creado: {} ({})", regressor.getName(), regressor.getDescription());
        return regressor;
    }

    /**
     * Parámetros por defecto de cada método.
     */
    public static MethodConfig defaultsFor(RegressionMethod method) {
        return switch (method) {
            case KNN -> KnnConfig.defaults();
            case MLR -> MlrConfig.defaults();
            case RF -> RandomForestConfig.defaults();
            case SVM -> SvmConfig.defaults();
        };
    }
}
