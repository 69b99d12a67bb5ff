package projectsdb.processing.stage;

import lombok.extern.slf4j.Slf4j;
import projectsdb.domain.raster.RasterBounds;
import projectsdb.domain.sample.SamplePoint;
import projectsdb.domain.sample.SampleTable;
import projectsdb.processing.i.IProcessingComponent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Descarta los puntos que quedan fuera de la caja del ráster. Debe ejecutarse después de la
 * reproyección, ya que compara coordenadas en el CRS del ráster.
 */
@Slf4j
public class SpatialFilter implements IProcessingComponent {

    public static final String FILTER_LABEL = "Filtering Out of Bound Points...";
    public static final String SKIP_LABEL = "Skip Filtering Out of Bound Points...";

    @Override
    public String getName() {
        return "Spatial Filter";
    }

    public String stageLabel(boolean excludeOutOfBounds) {
        return excludeOutOfBounds ? FILTER_LABEL : SKIP_LABEL;
    }

    /**
     * Conserva los puntos estrictamente interiores ({@code x0 < x < x1} y {@code y0 < y < y1}).
     * El resultado queda indexado de forma contigua. Si {@code excludeOutOfBounds} es falso,
     * devuelve la muestra tal cual.
     */
    public SampleTable filter(SampleTable samples, RasterBounds bounds, boolean excludeOutOfBounds) {
        if (!excludeOutOfBounds) {
            return samples;
        }
        List<SamplePoint> inside = samples.points().stream()
                .filter(p -> bounds.strictlyContains(p.x(), p.y()))
                .collect(Collectors.toList());

        int removed = samples.size() - inside.size();
        if (removed > 0) {
            log.info("Filtrado espacial: {} de {} puntos fuera de los límites del ráster.", removed, samples.size());
        }
        return samples.withPoints(inside);
    }
}
