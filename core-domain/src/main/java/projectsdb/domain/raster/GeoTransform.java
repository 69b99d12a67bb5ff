package projectsdb.domain.raster;

/**
 * Transformación afín entre índices de píxel y coordenadas geográficas.
 * <pre>
 *   x = a * col + b * row + c
 *   y = d * col + e * row + f
 * </pre>
 * Las coordenadas (col, row) se refieren a la esquina superior izquierda del píxel.
 *
 * @param a Tamaño del píxel en X (columna → x).
 * @param b Rotación (fila → x).
 * @param c X de la esquina superior izquierda.
 * @param d Rotación (columna → y).
 * @param e Tamaño del píxel en Y, normalmente negativo (fila → y).
 * @param f Y de la esquina superior izquierda.
 */
public record GeoTransform(double a, double b, double c, double d, double e, double f) {

    public GeoTransform {
        double det = a * e - b * d;
        if (det == 0.0 || Double.isNaN(det)) {
            throw new IllegalArgumentException("Transformación afín degenerada (determinante " + det + ").");
        }
    }

    /**
     * Transformación sin rotación, la habitual en imágenes norte-arriba.
     */
    public static GeoTransform northUp(double originX, double originY, double pixelWidth, double pixelHeight) {
        return new GeoTransform(pixelWidth, 0.0, originX, 0.0, -Math.abs(pixelHeight), originY);
    }

    public double[] toGeographic(double col, double row) {
        return new double[]{a * col + b * row + c, d * col + e * row + f};
    }

    /**
     * Transformación inversa: coordenada geográfica a (col, row) fraccionarios.
     */
    public double[] toPixel(double x, double y) {
        double det = a * e - b * d;
        double dx = x - c;
        double dy = y - f;
        double col = (e * dx - b * dy) / det;
        double row = (-d * dx + a * dy) / det;
        return new double[]{col, row};
    }

    /**
     * Tamaño absoluto del píxel (ancho, alto) en unidades del CRS.
     */
    public double[] pixelSize() {
        double[] origin = toGeographic(0, 0);
        double[] diagonal = toGeographic(1, 1);
        return new double[]{Math.abs(diagonal[0] - origin[0]), Math.abs(diagonal[1] - origin[1])};
    }
}
