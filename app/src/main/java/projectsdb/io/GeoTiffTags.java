package projectsdb.io;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Etiquetas GeoTIFF que usan el lector y el escritor, y acceso genérico a sus valores.
 */
final class GeoTiffTags {

    static final int MODEL_PIXEL_SCALE = 33550;
    static final int MODEL_TIEPOINT = 33922;
    static final int MODEL_TRANSFORMATION = 34264;
    static final int GEO_KEY_DIRECTORY = 34735;
    static final int GDAL_NODATA = 42113;

    static final int KEY_MODEL_TYPE = 1024;
    static final int KEY_RASTER_TYPE = 1025;
    static final int KEY_GEOGRAPHIC_TYPE = 2048;
    static final int KEY_PROJECTED_TYPE = 3072;

    static final int MODEL_TYPE_PROJECTED = 1;
    static final int MODEL_TYPE_GEOGRAPHIC = 2;
    static final int RASTER_PIXEL_IS_AREA = 1;

    private GeoTiffTags() {
    }

    /**
     * Valores numéricos de la etiqueta, o lista vacía si el directorio no la contiene.
     */
    static List<Number> numbers(FileDirectory directory, int tag) {
        Object values = rawValues(directory, tag);
        List<Number> out = new ArrayList<>();
        if (values instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Number number) {
                    out.add(number);
                }
            }
        } else if (values instanceof Number number) {
            out.add(number);
        }
        return out;
    }

    /**
     * Valor textual de la etiqueta sin el terminador nulo, o {@code null} si no existe.
     */
    static String text(FileDirectory directory, int tag) {
        Object values = rawValues(directory, tag);
        if (values == null) {
            return null;
        }
        Object first = values instanceof List<?> list ? (list.isEmpty() ? null : list.get(0)) : values;
        return first == null ? null : first.toString().replace("\u0000", "").trim();
    }

    private static Object rawValues(FileDirectory directory, int tag) {
        FieldTagType type = FieldTagType.getById(tag);
        if (type == null) {
            return null;
        }
        for (FileDirectoryEntry entry : directory.getEntries()) {
            if (entry.getFieldTag() == type) {
                return entry.getValues();
            }
        }
        return null;
    }
}
