package projectsdb.domain.sample;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registro de la muestra de profundidades: una geometría y su tabla de atributos.
 *
 * @param geometry   Geometría JTS. El pipeline solo admite {@link Point}.
 * @param attributes Atributos por nombre, en el orden de la fuente. Admite valores nulos.
 */
public record SamplePoint(Geometry geometry, Map<String, Object> attributes) {

    public SamplePoint {
        Objects.requireNonNull(geometry, "La geometría no puede ser nula.");
        attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean isPoint() {
        return geometry instanceof Point;
    }

    public double x() {
        return geometry.getCoordinate().getX();
    }

    public double y() {
        return geometry.getCoordinate().getY();
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Valor numérico de un atributo, o NaN si falta o es nulo.
     *
     * @throws IllegalArgumentException si el atributo existe pero no es numérico.
     */
    public double numericAttribute(String name) {
        Object value = attributes.get(name);
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("El atributo '" + name + "' no es numérico: " + value);
    }

    public SamplePoint withGeometry(Geometry newGeometry) {
        return new SamplePoint(newGeometry, attributes);
    }
}
