package projectsdb.domain.sample;

/**
 * Registro de test junto con la profundidad predicha por el modelo (columna "validated").
 */
public record ValidatedRecord(SampleRecord record, double validated) {

    public double residual() {
        return validated - record.depth();
    }
}
