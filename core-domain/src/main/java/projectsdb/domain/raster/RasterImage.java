package projectsdb.domain.raster;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Imagen ráster multibanda, inmutable una vez cargada.
 * <p>
 * Los valores se guardan banda a banda en orden de fila ({@code pixel = row * width + col}).
 * La instancia es de solo lectura para el pipeline, por lo que puede compartirse entre ejecuciones.
 */
public final class RasterImage {

    @Getter
    private final int width;
    @Getter
    private final int height;
    @Getter
    private final GeoTransform transform;
    @Getter
    private final String crs;
    private final Double nodata;
    private final double[][] bands;

    /**
     * @param width     Número de columnas.
     * @param height    Número de filas.
     * @param bands     Un array por banda, cada uno de longitud {@code width * height}.
     * @param transform Transformación píxel → coordenada.
     * @param crs       Identificador del sistema de referencia (ej: "EPSG:32750").
     * @param nodata    Valor centinela de ausencia de dato, o {@code null}.
     */
    public RasterImage(int width, int height, double[][] bands, GeoTransform transform, String crs, Double nodata) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensiones de ráster inválidas: " + width + " x " + height);
        }
        Objects.requireNonNull(bands, "Las bandas no pueden ser nulas.");
        Objects.requireNonNull(transform, "La transformación afín no puede ser nula.");
        Objects.requireNonNull(crs, "El CRS del ráster no puede ser nulo.");
        if (bands.length == 0) {
            throw new IllegalArgumentException("El ráster debe tener al menos una banda.");
        }
        int pixelCount = width * height;
        double[][] copy = new double[bands.length][];
        for (int b = 0; b < bands.length; b++) {
            if (bands[b] == null || bands[b].length != pixelCount) {
                throw new IllegalArgumentException("La banda " + (b + 1) + " no tiene " + pixelCount + " píxeles.");
            }
            copy[b] = bands[b].clone();
        }
        this.width = width;
        this.height = height;
        this.bands = copy;
        this.transform = transform;
        this.crs = crs;
        this.nodata = nodata;
    }

    public int getBandCount() {
        return bands.length;
    }

    public int getPixelCount() {
        return width * height;
    }

    /**
     * Nombres de columna de las bandas, numeradas desde 1 ("band1", "band2", ...).
     */
    public List<String> getBandNames() {
        return IntStream.rangeClosed(1, bands.length)
                .mapToObj(i -> "band" + i)
                .collect(Collectors.toList());
    }

    public Double getNodata() {
        return nodata;
    }

    /**
     * Valor de una banda (índice base 0) en una celda.
     *
     * @throws IndexOutOfBoundsException si la celda está fuera de la rejilla.
     */
    public double getValue(int band, int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("Celda (" + row + ", " + col + ") fuera de la rejilla " + height + " x " + width);
        }
        return bands[band][row * width + col];
    }

    /**
     * Indica si el valor es NaN o coincide con el centinela nodata.
     */
    public boolean isMissing(double value) {
        return Double.isNaN(value) || (nodata != null && value == nodata);
    }

    /**
     * Copia de una banda completa (índice base 0).
     */
    public double[] cloneBand(int band) {
        return bands[band].clone();
    }

    /**
     * Matriz (píxeles × bandas) para la predicción de la imagen completa.
     * Los NaN se sustituyen por {@code missingFill}.
     */
    public double[][] toFeatureMatrix(double missingFill) {
        int pixels = getPixelCount();
        double[][] features = new double[pixels][bands.length];
        for (int p = 0; p < pixels; p++) {
            for (int b = 0; b < bands.length; b++) {
                double v = bands[b][p];
                features[p][b] = Double.isNaN(v) ? missingFill : v;
            }
        }
        return features;
    }

    /**
     * Caja envolvente calculada a partir de las cuatro esquinas de la rejilla.
     */
    public RasterBounds getBounds() {
        double[][] corners = {
                transform.toGeographic(0, 0),
                transform.toGeographic(width, 0),
                transform.toGeographic(0, height),
                transform.toGeographic(width, height)
        };
        double minX = Arrays.stream(corners).mapToDouble(p -> p[0]).min().orElseThrow();
        double maxX = Arrays.stream(corners).mapToDouble(p -> p[0]).max().orElseThrow();
        double minY = Arrays.stream(corners).mapToDouble(p -> p[1]).min().orElseThrow();
        double maxY = Arrays.stream(corners).mapToDouble(p -> p[1]).max().orElseThrow();
        return new RasterBounds(minX, minY, maxX, maxY);
    }
}
