package projectsdb.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectsdb.config.KnnConfig;
import projectsdb.config.RandomForestConfig;
import projectsdb.config.RegressionMethod;
import projectsdb.domain.exception.ConfigurationException;
import projectsdb.processing.regressor.KnnRegressor;
import projectsdb.processing.regressor.LinearRegressor;
import projectsdb.processing.regressor.RandomForestRegressor;
import projectsdb.processing.regressor.SupportVectorRegressor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegressorFactoryTest {

    private final RegressorFactory factory = new RegressorFactory();

    @Test
    @DisplayName("Cada método produce su estimador, sin ajustar")
    void create_returnsMatchingImplementation() {
        assertThat(factory.create(RegressionMethod.KNN, RegressorFactory.defaultsFor(RegressionMethod.KNN))).isInstanceOf(KnnRegressor.class);
        assertThat(factory.create(RegressionMethod.MLR, RegressorFactory.defaultsFor(RegressionMethod.MLR))).isInstanceOf(LinearRegressor.class);
        assertThat(factory.create(RegressionMethod.RF, RegressorFactory.defaultsFor(RegressionMethod.RF))).isInstanceOf(RandomForestRegressor.class);
        assertThat(factory.create(RegressionMethod.SVM, RegressorFactory.defaultsFor(RegressionMethod.SVM)))
                .isInstanceOf(SupportVectorRegressor.class)
                .matches(r -> !r.isFitted());
    }

    @Test
    @DisplayName("Parámetros de otro método son un error de configuración")
    void create_rejectsMismatchedConfig() {
        assertThatThrownBy(() -> factory.create(RegressionMethod.SVM, KnnConfig.defaults()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("KNN");
    }

    @Test
    @DisplayName("Los parámetros se validan antes de construir el estimador")
    void create_validatesConfig() {
        RandomForestConfig invalid = RandomForestConfig.defaults().withTrees(0);

        assertThatThrownBy(() -> factory.create(RegressionMethod.RF, invalid)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> factory.create(RegressionMethod.RF, null)).isInstanceOf(ConfigurationException.class);
    }
}
