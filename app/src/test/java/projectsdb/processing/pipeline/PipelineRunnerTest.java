package projectsdb.processing.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import projectsdb.SdbTestFixtures;
import projectsdb.config.KnnConfig;
import projectsdb.config.ProcessingConfig;
import projectsdb.domain.event.FailureReason;
import projectsdb.domain.event.PipelineFailure;
import projectsdb.domain.event.ProgressEvent;
import projectsdb.domain.exception.OutOfBoundsException;
import projectsdb.domain.prediction.PredictionResult;
import projectsdb.factory.RegressorFactory;
import projectsdb.processing.i.IPipelineListener;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineRunnerTest {

    private PipelineRunner runner;
    private IPipelineListener listener;

    @BeforeEach
    void setUp() {
        SteppingClock clock = new SteppingClock(Instant.parse("2024-05-01T08:00:00Z"), Duration.ofMillis(100));
        runner = new PipelineRunner(new BathymetryPipeline(new RegressorFactory(), clock), clock);
        listener = mock(IPipelineListener.class);
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    private static ProcessingConfig knn() {
        return ProcessingConfig.builder().depthLabel("z").build();
    }

    @Test
    @DisplayName("Una ejecución correcta entrega siete eventos y después onCompleted")
    void submit_success() throws Exception {
        // --- 1. Arrange ---
        PipelineRequest request = new PipelineRequest(knn(), KnnConfig.defaults().withNeighbors(3),
                SdbTestFixtures.raster(), SdbTestFixtures.cellSamples(16));

        // --- 2. Act ---
        PredictionResult result = runner.submit(request, listener).get(30, TimeUnit.SECONDS);

        // --- 3. Assert ---
        InOrder order = inOrder(listener);
        order.verify(listener, times(7)).onProgress(any(ProgressEvent.class));
        order.verify(listener).onCompleted(result);
        verify(listener, never()).onFailed(any());
    }

    @Test
    @DisplayName("Si todos los puntos caen fuera, se notifica OUT_OF_BOUNDS y nunca onCompleted")
    void submit_outOfBounds() {
        PipelineRequest request = new PipelineRequest(knn(), KnnConfig.defaults(), SdbTestFixtures.raster(),
                SdbTestFixtures.table(SdbTestFixtures.UTM_50S, SdbTestFixtures.point(1.0, 1.0, -3.0)));

        CompletableFuture<PredictionResult> future = runner.submit(request, listener);

        assertThatThrownBy(() -> future.get(30, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(OutOfBoundsException.class);
        ArgumentCaptor<PipelineFailure> failure = ArgumentCaptor.forClass(PipelineFailure.class);
        verify(listener).onFailed(failure.capture());
        assertThat(failure.getValue().reason()).isEqualTo(FailureReason.OUT_OF_BOUNDS);
        verify(listener, times(3)).onProgress(any(ProgressEvent.class));
        verify(listener, never()).onCompleted(any());
    }

    @Test
    @DisplayName("Un error no tipado se notifica como UNEXPECTED")
    void submit_unexpectedError() {
        BathymetryPipeline broken = mock(BathymetryPipeline.class);
        when(broken.run(any(), any())).thenThrow(new IllegalStateException("fallo interno"));
        PipelineRequest request = new PipelineRequest(knn(), KnnConfig.defaults(), SdbTestFixtures.raster(),
                SdbTestFixtures.cellSamples(8));

        try (PipelineRunner brokenRunner = new PipelineRunner(broken)) {
            CompletableFuture<PredictionResult> future = brokenRunner.submit(request, listener);

            assertThatThrownBy(() -> future.get(30, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }
        ArgumentCaptor<PipelineFailure> failure = ArgumentCaptor.forClass(PipelineFailure.class);
        verify(listener).onFailed(failure.capture());
        assertThat(failure.getValue().reason()).isEqualTo(FailureReason.UNEXPECTED);
        assertThat(failure.getValue().message()).isEqualTo("fallo interno");
        verify(listener, never()).onCompleted(any());
    }

    @Test
    @DisplayName("Un suscriptor nulo no impide la ejecución")
    void submit_nullListener() throws Exception {
        PipelineRequest request = new PipelineRequest(knn(), KnnConfig.defaults().withNeighbors(2),
                SdbTestFixtures.raster(), SdbTestFixtures.cellSamples(12));

        PredictionResult result = runner.submit(request, null).get(30, TimeUnit.SECONDS);

        assertThat(result.getPredictedDepth()).hasSize(16);
    }
}
