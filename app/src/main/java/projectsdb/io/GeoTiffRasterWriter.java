package projectsdb.io;

import lombok.extern.slf4j.Slf4j;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.proj.LongLatProjection;
import projectsdb.domain.prediction.PredictionResult;
import projectsdb.domain.raster.GeoTransform;
import projectsdb.processing.postprocess.MedianFilter;
import projectsdb.processing.stage.GeometryNormalizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Escribe la predicción como GeoTIFF de una banda en coma flotante de 32 bits,
 * con la georreferencia y el CRS del ráster de entrada. Los píxeles sin valor se
 * declaran con la etiqueta nodata de GDAL ({@code nan}).
 */
@Slf4j
public class GeoTiffRasterWriter {

    static final String NODATA_TEXT = "nan";

    private final MedianFilter medianFilter;

    public GeoTiffRasterWriter() {
        this(new MedianFilter(0));
    }

    public GeoTiffRasterWriter(MedianFilter medianFilter) {
        this.medianFilter = medianFilter;
    }

    public void write(PredictionResult result, Path path) throws IOException {
        double[] values = medianFilter.apply(result.getPredictedDepth(), result.getWidth(), result.getHeight());
        write(values, result.getWidth(), result.getHeight(), result.getTransform(), result.getCrs(), path);
    }

    public void write(double[] values, int width, int height, GeoTransform transform, String crs, Path path) throws IOException {
        log.info("Escribiendo GeoTIFF {}x{} en {}", width, height, path.toAbsolutePath());

        Rasters rasters = new Rasters(width, height, 1, FieldType.FLOAT);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                rasters.setFirstPixelSample(col, row, (float) values[row * width + col]);
            }
        }

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(32);
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);
        directory.setWriteRasters(rasters);
        addGeoreference(directory, transform);
        addGeoKeys(directory, crs);
        addNodata(directory);

        TIFFImage image = new TIFFImage();
        image.add(directory);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            TiffWriter.writeTiff(path.toFile(), image);
        } catch (IOException e) {
            log.error("Error al escribir el GeoTIFF {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private void addGeoreference(FileDirectory directory, GeoTransform t) {
        if (t.b() == 0.0 && t.d() == 0.0) {
            directory.addEntry(doubles(GeoTiffTags.MODEL_PIXEL_SCALE, List.of(t.a(), -t.e(), 0.0)));
            directory.addEntry(doubles(GeoTiffTags.MODEL_TIEPOINT, List.of(0.0, 0.0, 0.0, t.c(), t.f(), 0.0)));
            return;
        }
        // Rotada: matriz 4x4 por filas.
        directory.addEntry(doubles(GeoTiffTags.MODEL_TRANSFORMATION, List.of(
                t.a(), t.b(), 0.0, t.c(),
                t.d(), t.e(), 0.0, t.f(),
                0.0, 0.0, 0.0, 0.0,
                0.0, 0.0, 0.0, 1.0)));
    }

    private void addGeoKeys(FileDirectory directory, String crs) {
        List<Integer> keys = new ArrayList<>(List.of(1, 1, 0, 0));
        keys.addAll(List.of(GeoTiffTags.KEY_RASTER_TYPE, 0, 1, GeoTiffTags.RASTER_PIXEL_IS_AREA));

        Integer epsg = epsgCode(crs);
        if (epsg != null) {
            boolean geographic = isGeographic(crs);
            keys.addAll(4, List.of(GeoTiffTags.KEY_MODEL_TYPE, 0, 1,
                    geographic ? GeoTiffTags.MODEL_TYPE_GEOGRAPHIC : GeoTiffTags.MODEL_TYPE_PROJECTED));
            keys.addAll(List.of(geographic ? GeoTiffTags.KEY_GEOGRAPHIC_TYPE : GeoTiffTags.KEY_PROJECTED_TYPE, 0, 1, epsg));
        } else {
            log.warn("CRS '{}' sin código EPSG: el GeoTIFF se escribe sin sistema de referencia.", crs);
        }
        keys.set(3, (keys.size() - 4) / 4);
        directory.addEntry(new FileDirectoryEntry(FieldTagType.getById(GeoTiffTags.GEO_KEY_DIRECTORY),
                FieldType.SHORT, keys.size(), keys));
    }

    // Los píxeles enmascarados son NaN; GDAL y los SIG leen el centinela de esta etiqueta.
    private void addNodata(FileDirectory directory) {
        directory.addEntry(new FileDirectoryEntry(FieldTagType.getById(GeoTiffTags.GDAL_NODATA),
                FieldType.ASCII, NODATA_TEXT.length() + 1, List.of(NODATA_TEXT)));
    }

    private static FileDirectoryEntry doubles(int tag, List<Double> values) {
        return new FileDirectoryEntry(FieldTagType.getById(tag), FieldType.DOUBLE, values.size(), values);
    }

    static Integer epsgCode(String crs) {
        if (crs == null) {
            return null;
        }
        String canonical = GeometryNormalizer.canonicalCrs(crs);
        if (!canonical.startsWith("EPSG:")) {
            return null;
        }
        try {
            return Integer.valueOf(canonical.substring("EPSG:".length()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isGeographic(String crs) {
        try {
            return new CRSFactory().createFromName(GeometryNormalizer.canonicalCrs(crs)).getProjection() instanceof LongLatProjection;
        } catch (Proj4jException | IllegalArgumentException | IllegalStateException e) {
            log.warn("No se puede resolver '{}', se asume CRS proyectado.", crs);
            return false;
        }
    }
}
