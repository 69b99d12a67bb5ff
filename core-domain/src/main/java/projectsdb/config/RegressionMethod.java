package projectsdb.config;

/**
 * Algoritmos de regresión disponibles para estimar la profundidad.
 * <p>
 * Sustituye la selección por texto de la interfaz: cada punto de despacho
 * debe cubrir las cuatro variantes con un {@code switch} exhaustivo.
 */
public enum RegressionMethod {
    KNN("K-Nearest Neighbors"),
    MLR("Multiple Linear Regression"),
    RF("Random Forest"),
    SVM("Support Vector Machines");

    private final String displayName;

    RegressionMethod(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
