package projectsdb.processing.pipeline;

import projectsdb.config.MethodConfig;
import projectsdb.config.PipelineSettings;
import projectsdb.config.ProcessingConfig;
import projectsdb.domain.raster.RasterImage;
import projectsdb.domain.sample.SampleTable;

/**
 * Entrada completa de una ejecución. Cualquier componente puede ser nulo aquí:
 * las precondiciones se comprueban en el pipeline y se notifican como fallo tipado.
 */
public record PipelineRequest(
        ProcessingConfig config,
        MethodConfig methodConfig,
        RasterImage raster,
        SampleTable samples
) {

    public static PipelineRequest of(PipelineSettings settings, RasterImage raster, SampleTable samples) {
        return new PipelineRequest(settings.processing(), settings.methodConfig(), raster, samples);
    }
}
