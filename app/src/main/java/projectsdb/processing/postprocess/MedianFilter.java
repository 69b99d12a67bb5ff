package projectsdb.processing.postprocess;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import projectsdb.processing.i.IProcessingComponent;

/**
 * Filtro de mediana cuadrado para suavizar la predicción antes de exportarla.
 * <p>
 * El borde se refleja ({@code d c b a | a b c d | d c b a}). Los NaN de la ventana se ignoran;
 * si toda la ventana es NaN, el píxel sigue siendo NaN. Con tamaño par la ventana
 * cubre {@code [-size/2, size/2 - 1]} alrededor del píxel.
 */
@Slf4j
public class MedianFilter implements IProcessingComponent {

    @Getter
    private final int size;

    /**
     * @param size Lado de la ventana en píxeles. Un valor {@code <= 1} desactiva el filtro.
     */
    public MedianFilter(int size) {
        this.size = size;
    }

    @Override
    public String getName() {
        return "Median Filter";
    }

    @Override
    public String getDescription() {
        return isEnabled() ? "Ventana " + size + "x" + size : "Desactivado";
    }

    public boolean isEnabled() {
        return size > 1;
    }

    /**
     * @param values Píxeles en orden de fila ({@code width * height}).
     * @return Una copia filtrada; la entrada no se modifica.
     */
    public double[] apply(double[] values, int width, int height) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Se esperaban " + (width * height) + " píxeles y hay " + values.length);
        }
        if (!isEnabled()) {
            return values.clone();
        }
        log.info("Aplicando filtro de mediana {}x{} a una imagen de {}x{}", size, size, width, height);

        Median median = new Median();
        double[] window = new double[size * size];
        double[] out = new double[values.length];
        int lo = -(size / 2);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int count = 0;
                for (int dr = lo; dr < lo + size; dr++) {
                    int r = reflect(row + dr, height);
                    for (int dc = lo; dc < lo + size; dc++) {
                        double v = values[r * width + reflect(col + dc, width)];
                        if (!Double.isNaN(v)) {
                            window[count++] = v;
                        }
                    }
                }
                out[row * width + col] = count == 0 ? Double.NaN : median.evaluate(window, 0, count);
            }
        }
        return out;
    }

    static int reflect(int index, int length) {
        int i = index;
        while (i < 0 || i >= length) {
            i = i < 0 ? -i - 1 : 2 * length - i - 1;
        }
        return i;
    }
}
