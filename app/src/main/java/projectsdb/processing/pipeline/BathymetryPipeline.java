package projectsdb.processing.pipeline;

import lombok.extern.slf4j.Slf4j;
import projectsdb.config.MethodConfig;
import projectsdb.config.ProcessingConfig;
import projectsdb.domain.event.PipelineState;
import projectsdb.domain.exception.ConfigurationException;
import projectsdb.domain.exception.InvalidSampleTypeException;
import projectsdb.domain.exception.MissingInputException;
import projectsdb.domain.exception.SdbProcessingException;
import projectsdb.domain.prediction.PredictionResult;
import projectsdb.domain.raster.RasterImage;
import projectsdb.domain.sample.SampleTable;
import projectsdb.domain.sample.SampledDataset;
import projectsdb.domain.sample.SamplePoint;
import projectsdb.domain.sample.SplitResult;
import projectsdb.factory.RegressorFactory;
import projectsdb.processing.i.IPipelineListener;
import projectsdb.processing.i.IRegressor;
import projectsdb.processing.parallel.ParallelContext;
import projectsdb.processing.stage.DatasetSplitter;
import projectsdb.processing.stage.GeometryNormalizer;
import projectsdb.processing.stage.RasterSampler;
import projectsdb.processing.stage.SpatialFilter;
import projectsdb.processing.stage.ValueNormalizer;
import projectsdb.processing.stage.Validator;

import java.time.Clock;

/**
 * Orquestador síncrono de una ejecución completa de batimetría.
 * <p>
 * Encadena las etapas en orden fijo y emite un evento de progreso antes de cada una
 * (siete en una ejecución completa). Cualquier error deja la ejecución en {@link PipelineState#FAILED}
 * y se propaga sin resultado parcial. Para ejecutarlo fuera del hilo llamador, ver {@link PipelineRunner}.
 */
@Slf4j
public class BathymetryPipeline {

    public static final String FITTING_LABEL = "Fitting...";
    public static final String PREDICTING_LABEL = "Predicting...";
    public static final String DONE_LABEL = "Done.";

    private final GeometryNormalizer geometryNormalizer;
    private final SpatialFilter spatialFilter;
    private final RasterSampler rasterSampler;
    private final ValueNormalizer valueNormalizer;
    private final DatasetSplitter splitter;
    private final RegressorFactory regressorFactory;
    private final Validator validator;
    private final Clock clock;

    public BathymetryPipeline() {
        this(new RegressorFactory(), Clock.systemUTC());
    }

    public BathymetryPipeline(RegressorFactory regressorFactory, Clock clock) {
        this(new GeometryNormalizer(), new SpatialFilter(), new RasterSampler(), new ValueNormalizer(),
                new DatasetSplitter(), regressorFactory, new Validator(), clock);
    }

    public BathymetryPipeline(GeometryNormalizer geometryNormalizer, SpatialFilter spatialFilter,
                              RasterSampler rasterSampler, ValueNormalizer valueNormalizer,
                              DatasetSplitter splitter, RegressorFactory regressorFactory,
                              Validator validator, Clock clock) {
        this.geometryNormalizer = geometryNormalizer;
        this.spatialFilter = spatialFilter;
        this.rasterSampler = rasterSampler;
        this.valueNormalizer = valueNormalizer;
        this.splitter = splitter;
        this.regressorFactory = regressorFactory;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Ejecuta el pipeline completo en el hilo actual.
     *
     * @param request  Configuración y entradas de la ejecución.
     * @param listener Recibe los eventos de progreso. Los eventos terminales los emite el llamador.
     * @return El resultado agregado.
     * @throws SdbProcessingException si falla alguna precondición o etapa.
     */
    public PredictionResult run(PipelineRequest request, IPipelineListener listener) {
        PipelineRunContext run = new PipelineRunContext(clock, listener);
        try {
            return execute(request, run);
        } catch (RuntimeException e) {
            log.debug("Ejecución abortada en el estado {}", run.getState());
            run.fail();
            throw e;
        }
    }

    private PredictionResult execute(PipelineRequest request, PipelineRunContext run) {
        // --- 0. PRECONDICIONES (antes de cualquier evento) ---
        if (request == null) {
            throw new MissingInputException("No se ha recibido ninguna petición de ejecución.");
        }
        RasterImage raster = request.raster();
        SampleTable samples = request.samples();
        checkInputs(raster, samples);
        ProcessingConfig config = checkConfig(request);
        MethodConfig methodConfig = request.methodConfig();
        checkSamples(samples, config.getDepthLabel());

        // --- 1. REPROYECCIÓN ---
        run.enter(PipelineState.REPROJECTING, geometryNormalizer.stageLabel(samples, raster.getCrs()));
        SampleTable reprojected = geometryNormalizer.normalize(samples, raster.getCrs());

        // --- 2. FILTRADO ESPACIAL ---
        run.enter(PipelineState.FILTERING, spatialFilter.stageLabel(config.isExcludeOutOfBounds()));
        SampleTable filtered = spatialFilter.filter(reprojected, raster.getBounds(), config.isExcludeOutOfBounds());

        // --- 3. MUESTREO + NORMALIZACIÓN ---
        run.enter(PipelineState.SAMPLING, RasterSampler.STAGE_LABEL);
        SampledDataset sampled;
        try (ParallelContext context = ParallelContext.open(config.getParallelism())) {
            sampled = rasterSampler.sample(filtered, raster, config.getDepthLabel(), context);
        }
        SampledDataset dataset = valueNormalizer.normalize(sampled, config);

        run.enterSilently(PipelineState.SPLITTING);
        SplitResult split = splitter.split(dataset, config.getTrainFraction(), config.getParallelism().randomSeed());

        // --- 4. AJUSTE ---
        IRegressor regressor = regressorFactory.create(config.getMethod(), methodConfig);
        run.enter(PipelineState.FITTING, FITTING_LABEL);
        try (ParallelContext context = ParallelContext.open(config.getParallelism())) {
            regressor.fit(split.trainFeatures(), split.trainTargets(), context);
        }

        // --- 5. PREDICCIÓN DE LA IMAGEN COMPLETA ---
        run.enter(PipelineState.PREDICTING_FULL, PREDICTING_LABEL);
        double[] predicted;
        try (ParallelContext context = ParallelContext.open(config.getParallelism())) {
            predicted = regressor.predict(raster.toFeatureMatrix(config.getMissingBandFill()), context);
        }
        if (config.isLimitEnabled()) {
            maskOutsideWindow(predicted, config.getLimitLower(), config.getLimitUpper());
        }

        // --- 6. VALIDACIÓN ---
        run.enter(PipelineState.VALIDATING, Validator.STAGE_LABEL);
        Validator.Outcome outcome;
        try (ParallelContext context = ParallelContext.open(config.getParallelism())) {
            outcome = validator.validate(regressor, split, context);
        }

        run.enter(PipelineState.DONE, DONE_LABEL);
        return PredictionResult.builder()
                .predictedDepth(predicted)
                .width(raster.getWidth())
                .height(raster.getHeight())
                .transform(raster.getTransform())
                .crs(raster.getCrs())
                .metrics(outcome.metrics())
                .trainRecords(split.trainRecords())
                .testRecords(outcome.validatedRecords())
                .normalizedSamples(filtered)
                .sampledDataset(dataset)
                .originalSampleCount(samples.size())
                .timeline(run.timeline())
                .config(config)
                .methodConfig(methodConfig)
                .build();
    }

    /**
     * Valida la configuración y la devuelve con la ventana de límites ordenada.
     */
    private ProcessingConfig checkConfig(PipelineRequest request) {
        if (request.config() == null) {
            throw new ConfigurationException("Falta la configuración de procesamiento.");
        }
        if (request.methodConfig() == null) {
            throw new ConfigurationException("Falta la configuración del método " + request.config().getMethod());
        }
        ProcessingConfig config = request.config();
        config.validate();
        ProcessingConfig normalized = config.normalized();
        if (normalized != config) {
            log.warn("Ventana de profundidad invertida [{}, {}], se intercambian los límites.",
                    config.getLimitLower(), config.getLimitUpper());
        }
        if (request.methodConfig().method() != normalized.getMethod()) {
            throw new ConfigurationException("El método " + normalized.getMethod()
                    + " no coincide con la configuración recibida (" + request.methodConfig().method() + ").");
        }
        request.methodConfig().validate();
        return normalized;
    }

    private static void checkInputs(RasterImage raster, SampleTable samples) {
        if (raster == null) {
            throw new MissingInputException("Please Select Imagery Data: no se ha cargado ningún ráster.");
        }
        if (samples == null) {
            throw new MissingInputException("Please Select Sample Data: no se ha cargado ninguna muestra.");
        }
        if (samples.isEmpty()) {
            throw new MissingInputException("La muestra cargada no contiene puntos.");
        }
    }

    private static void checkSamples(SampleTable samples, String depthLabel) {
        boolean labelFound = false;
        for (int i = 0; i < samples.size(); i++) {
            SamplePoint point = samples.get(i);
            if (!point.isPoint()) {
                throw new InvalidSampleTypeException("La muestra debe contener geometrías de tipo punto: el elemento "
                        + i + " es " + point.geometry().getGeometryType());
            }
            if (point.attributes().containsKey(depthLabel)) {
                labelFound = true;
                Object value = point.attribute(depthLabel);
                if (value != null && !(value instanceof Number)) {
                    throw new InvalidSampleTypeException("El atributo de profundidad '" + depthLabel
                            + "' no es numérico en el elemento " + i + ": " + value);
                }
            }
        }
        if (!labelFound) {
            throw new InvalidSampleTypeException("La muestra no contiene el atributo de profundidad '" + depthLabel + "'");
        }
    }

    static void maskOutsideWindow(double[] predicted, double lower, double upper) {
        int masked = 0;
        for (int i = 0; i < predicted.length; i++) {
            if (predicted[i] < lower || predicted[i] > upper) {
                predicted[i] = Double.NaN;
                masked++;
            }
        }
        log.debug("Predicción enmascarada fuera de [{}, {}]: {} píxeles.", lower, upper, masked);
    }
}
