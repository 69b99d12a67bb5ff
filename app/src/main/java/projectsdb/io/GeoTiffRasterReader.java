package projectsdb.io;

import lombok.extern.slf4j.Slf4j;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import projectsdb.domain.raster.GeoTransform;
import projectsdb.domain.raster.RasterImage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Carga un GeoTIFF multibanda como {@link RasterImage}.
 * <p>
 * La georreferencia se toma de ModelTransformation o, en su defecto, de
 * ModelPixelScale + ModelTiepoint (convención PixelIsArea). El CRS sale de la
 * GeoKeyDirectory (código EPSG proyectado o geográfico) y el valor nodata de la etiqueta de GDAL.
 */
@Slf4j
public class GeoTiffRasterReader {

    public RasterImage read(Path path) throws IOException {
        log.info("Leyendo ráster GeoTIFF: {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            TIFFImage image = TiffReader.readTiff(path.toFile());
            FileDirectory directory = image.getFileDirectories().get(0);
            Rasters rasters = directory.readRasters();

            int width = rasters.getWidth();
            int height = rasters.getHeight();
            int bandCount = rasters.getSamplesPerPixel();
            double[][] bands = new double[bandCount][width * height];
            for (int row = 0; row < height; row++) {
                for (int col = 0; col < width; col++) {
                    for (int b = 0; b < bandCount; b++) {
                        bands[b][row * width + col] = rasters.getPixelSample(b, col, row).doubleValue();
                    }
                }
            }

            GeoTransform transform = readTransform(directory, path);
            String crs = readCrs(directory, path);
            Double nodata = readNodata(directory);
            log.info("Ráster cargado: {}x{} píxeles, {} bandas, CRS {}, nodata {}", width, height, bandCount, crs, nodata);
            return new RasterImage(width, height, bands, transform, crs, nodata);
        } catch (IOException e) {
            log.error("Error al leer el GeoTIFF {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private GeoTransform readTransform(FileDirectory directory, Path path) throws IOException {
        List<Number> matrix = GeoTiffTags.numbers(directory, GeoTiffTags.MODEL_TRANSFORMATION);
        if (matrix.size() >= 16) {
            return new GeoTransform(matrix.get(0).doubleValue(), matrix.get(1).doubleValue(), matrix.get(3).doubleValue(),
                    matrix.get(4).doubleValue(), matrix.get(5).doubleValue(), matrix.get(7).doubleValue());
        }

        List<Number> scale = GeoTiffTags.numbers(directory, GeoTiffTags.MODEL_PIXEL_SCALE);
        List<Number> tiepoint = GeoTiffTags.numbers(directory, GeoTiffTags.MODEL_TIEPOINT);
        if (scale.size() < 2 || tiepoint.size() < 6) {
            throw new IOException("El archivo no contiene georreferencia (ModelPixelScale/ModelTiepoint): " + path);
        }
        double scaleX = scale.get(0).doubleValue();
        double scaleY = scale.get(1).doubleValue();
        double pixelI = tiepoint.get(0).doubleValue();
        double pixelJ = tiepoint.get(1).doubleValue();
        double originX = tiepoint.get(3).doubleValue() - pixelI * scaleX;
        double originY = tiepoint.get(4).doubleValue() + pixelJ * scaleY;
        return GeoTransform.northUp(originX, originY, scaleX, scaleY);
    }

    private String readCrs(FileDirectory directory, Path path) throws IOException {
        List<Number> keys = GeoTiffTags.numbers(directory, GeoTiffTags.GEO_KEY_DIRECTORY);
        // Cabecera de 4 valores y después bloques {clave, ubicación, número, valor}.
        for (int i = 4; i + 3 < keys.size(); i += 4) {
            int key = keys.get(i).intValue();
            if (key == GeoTiffTags.KEY_PROJECTED_TYPE || key == GeoTiffTags.KEY_GEOGRAPHIC_TYPE) {
                return "EPSG:" + keys.get(i + 3).intValue();
            }
        }
        throw new IOException("No se ha encontrado un código EPSG en la GeoKeyDirectory de " + path);
    }

    private Double readNodata(FileDirectory directory) {
        String text = GeoTiffTags.text(directory, GeoTiffTags.GDAL_NODATA);
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (text.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            log.warn("Valor nodata no numérico '{}', se ignora.", text);
            return null;
        }
    }
}
