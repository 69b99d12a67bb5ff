package projectsdb.domain.prediction;

/**
 * Métricas de exactitud sobre el conjunto de test.
 *
 * @param rmse Raíz del error cuadrático medio (>= 0).
 * @param mae  Error absoluto medio (>= 0).
 * @param r2   Coeficiente de determinación (<= 1 para objetivos con varianza finita).
 * @param n    Número de registros validados.
 */
public record ValidationMetrics(double rmse, double mae, double r2, int n) {
}
