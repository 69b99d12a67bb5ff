package projectsdb.processing.stage;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import projectsdb.domain.exception.ConfigurationException;
import projectsdb.domain.sample.SamplePoint;
import projectsdb.domain.sample.SampleTable;
import projectsdb.processing.i.IProcessingComponent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reproyecta los puntos de la muestra al CRS del ráster cuando ambos difieren.
 * <p>
 * Los identificadores se comparan en forma canónica y sin distinguir mayúsculas.
 * Se aceptan códigos de autoridad ("EPSG:32750", "urn:ogc:def:crs:EPSG::4326") y cadenas proj4 ("+proj=...").
 */
@Slf4j
public class GeometryNormalizer implements IProcessingComponent {

    public static final String REPROJECT_LABEL = "Reprojecting...";
    public static final String SKIP_LABEL = "Skip Reproject...";

    private static final String OGC_URN_PREFIX = "URN:OGC:DEF:CRS:";

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final GeometryFactory geometryFactory = new GeometryFactory();

    @Override
    public String getName() {
        return "Geometry Normalizer";
    }

    public boolean needsReprojection(SampleTable samples, String targetCrs) {
        return !canonicalCrs(samples.crs()).equals(canonicalCrs(targetCrs));
    }

    /**
     * Etiqueta del evento de inicio de la etapa para esta combinación de CRS.
     */
    public String stageLabel(SampleTable samples, String targetCrs) {
        return needsReprojection(samples, targetCrs) ? REPROJECT_LABEL : SKIP_LABEL;
    }

    /**
     * Devuelve una copia de la muestra expresada en {@code targetCrs}.
     *
     * @throws ConfigurationException si algún CRS no se puede resolver o la transformación
     *                                produce coordenadas no finitas.
     */
    public SampleTable normalize(SampleTable samples, String targetCrs) {
        if (!needsReprojection(samples, targetCrs)) {
            log.debug("CRS coincidente ({}), se omite la reproyección.", targetCrs);
            return samples.withPoints(new ArrayList<>(samples.points()));
        }

        CoordinateReferenceSystem source = resolve(samples.crs());
        CoordinateReferenceSystem target = resolve(targetCrs);
        CoordinateTransform transform = transformFactory.createTransform(source, target);
        log.info("Reproyectando {} puntos de {} a {}", samples.size(), samples.crs(), targetCrs);

        List<SamplePoint> reprojected = new ArrayList<>(samples.size());
        ProjCoordinate in = new ProjCoordinate();
        ProjCoordinate out = new ProjCoordinate();
        for (SamplePoint point : samples.points()) {
            Coordinate original = point.geometry().getCoordinate();
            in.x = original.getX();
            in.y = original.getY();
            try {
                transform.transform(in, out);
            } catch (Proj4jException e) {
                throw new ConfigurationException("No se puede reproyectar el punto (" + in.x + ", " + in.y + ") a " + targetCrs, e);
            }
            if (!Double.isFinite(out.x) || !Double.isFinite(out.y)) {
                throw new ConfigurationException("La reproyección de (" + in.x + ", " + in.y + ") a " + targetCrs
                        + " produce coordenadas degeneradas. Revise los CRS de entrada.");
            }
            Coordinate moved = new Coordinate(out.x, out.y, original.getZ());
            reprojected.add(point.withGeometry(geometryFactory.createPoint(moved)));
        }
        return samples.withCrs(targetCrs, reprojected);
    }

    private CoordinateReferenceSystem resolve(String crs) {
        String canonical = canonicalCrs(crs);
        try {
            if (canonical.startsWith("+")) {
                return crsFactory.createFromParameters(null, crs.trim());
            }
            return crsFactory.createFromName(canonical);
        } catch (Proj4jException | IllegalArgumentException | IllegalStateException e) {
            throw new ConfigurationException("CRS no reconocido: '" + crs + "'", e);
        }
    }

    /**
     * Forma canónica de un identificador de CRS: sin espacios, en mayúsculas y con las URN de OGC
     * reducidas a "AUTORIDAD:CÓDIGO".
     */
    public static String canonicalCrs(String crs) {
        if (crs == null || crs.isBlank()) {
            throw new ConfigurationException("CRS vacío.");
        }
        String value = crs.trim().toUpperCase(Locale.ROOT);
        if (value.startsWith("+")) {
            return value;
        }
        if (value.startsWith(OGC_URN_PREFIX)) {
            // urn:ogc:def:crs:EPSG::4326 -> EPSG:4326
            String[] parts = value.substring(OGC_URN_PREFIX.length()).split(":");
            if (parts.length >= 2) {
                return parts[0] + ":" + parts[parts.length - 1];
            }
        }
        return value;
    }
}
