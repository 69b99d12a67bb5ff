package projectsdb.domain.raster;

/**
 * Caja envolvente de un ráster en coordenadas de su CRS.
 */
public record RasterBounds(double left, double bottom, double right, double top) {

    public RasterBounds {
        if (left > right || bottom > top) {
            throw new IllegalArgumentException("Caja envolvente inválida: [" + left + ", " + bottom + ", " + right + ", " + top + "]");
        }
    }

    /**
     * Contención estricta: los puntos que tocan el borde quedan fuera.
     */
    public boolean strictlyContains(double x, double y) {
        return x > left && x < right && y > bottom && y < top;
    }
}
