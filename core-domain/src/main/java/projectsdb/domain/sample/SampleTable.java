package projectsdb.domain.sample;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Muestra de profundidades conocida: secuencia ordenada de puntos y su CRS.
 * <p>
 * Nunca se modifica en sitio; cada etapa del pipeline devuelve una copia.
 */
public record SampleTable(String crs, List<SamplePoint> points) {

    public SampleTable {
        Objects.requireNonNull(crs, "El CRS de la muestra no puede ser nulo.");
        points = List.copyOf(Objects.requireNonNull(points, "La lista de puntos no puede ser nula."));
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public SamplePoint get(int index) {
        return points.get(index);
    }

    /**
     * Nombres de atributo presentes en algún registro, en orden de aparición.
     */
    public Set<String> attributeNames() {
        Set<String> names = new LinkedHashSet<>();
        points.forEach(p -> names.addAll(p.attributes().keySet()));
        return names;
    }

    public SampleTable withPoints(List<SamplePoint> newPoints) {
        return new SampleTable(crs, newPoints);
    }

    public SampleTable withCrs(String newCrs, List<SamplePoint> newPoints) {
        return new SampleTable(newCrs, newPoints);
    }
}
