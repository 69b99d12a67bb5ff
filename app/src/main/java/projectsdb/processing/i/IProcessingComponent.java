package projectsdb.processing.i;

/**
 * Contrato base de los componentes del pipeline.
 * Permite tratar etapas y estimadores de forma polimórfica para logging e identificación.
 */
public interface IProcessingComponent {
    /**
     * Nombre corto del componente (ej: "KNN", "Raster Sampler").
     */
    String getName();

    /**
     * Descripción técnica detallada de la configuración activa.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
