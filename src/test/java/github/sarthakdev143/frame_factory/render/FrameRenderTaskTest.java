package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.ImageFormat;
import github.sarthakdev143.frame_factory.model.asset.AssetType;
import github.sarthakdev143.frame_factory.model.asset.RenderAsset;
import github.sarthakdev143.frame_factory.render.pool.WorkerPool;
import github.sarthakdev143.frame_factory.render.worker.FrameWorker;
import github.sarthakdev143.frame_factory.render.worker.PageErrorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class FrameRenderTaskTest {

    private static final Path OUTPUT = Path.of("out/element-12.jpeg");

    @Mock
    private RenderCallbacks callbacks;

    private StubFrameWorker worker;
    private WorkerPool<FrameWorker> pool;
    private AtomicInteger framesRendered;
    private CompletableFuture<Void> renderFailure;

    @BeforeEach
    void setUp() {
        worker = new StubFrameWorker("worker-1");
        pool = new WorkerPool<>(List.of(worker));
        framesRendered = new AtomicInteger();
        renderFailure = new CompletableFuture<>();
    }

    @Test
    void runSeeksCapturesAndCollectsAssets() {
        RenderAsset asset = new RenderAsset("audio-1", 12, AssetType.AUDIO, "https://cdn.test/a.mp3", 0, 1.0, 1.0, false);
        worker.assetsForFrame = frame -> List.of(asset);

        List<RenderAsset> assets = task(12, ImageFormat.JPEG, 80).run().join();

        assertThat(assets).containsExactly(asset);
        assertThat(worker.seekedFrames).containsExactly(12);
        assertThat(worker.captures).containsExactly(OUTPUT);
        assertThat(worker.captureQualities).containsExactly(80);
        assertThat(framesRendered).hasValue(1);
        assertThat(pool.availableCount()).isEqualTo(1);
        assertThat(worker.listeners).isEmpty();
        verify(callbacks).onFrameUpdate(1, OUTPUT, 12);
        verify(callbacks, never()).onError(any(), any());
    }

    @Test
    void runSkipsCaptureWhenImagesAreDisabled() {
        task(3, ImageFormat.NONE, null).run().join();

        assertThat(worker.captures).isEmpty();
        assertThat(worker.seekedFrames).containsExactly(3);
        verify(callbacks).onFrameUpdate(eq(1), any(Path.class), eq(3));
    }

    @Test
    void runDropsQualityForLosslessFormat() {
        task(3, ImageFormat.PNG, 90).run().join();

        assertThat(worker.captureQualities).hasSize(1);
        assertThat(worker.captureQualities.get(0)).isNull();
    }

    @Test
    void runRewritesSeekTimeoutIntoDedicatedError() {
        worker.seekBehaviour = frame -> CompletableFuture.failedFuture(
                new RuntimeException("Navigation timeout of 30000 ms exceeded"));

        CompletableFuture<List<RenderAsset>> result = task(12, ImageFormat.JPEG, null).run();

        assertThatThrownBy(result::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(RenderTimeoutException.class)
                .hasMessageContaining("The rendering timed out");

        ArgumentCaptor<Throwable> reported = ArgumentCaptor.forClass(Throwable.class);
        verify(callbacks).onError(reported.capture(), eq(12));
        assertThat(reported.getValue()).isInstanceOf(RenderTimeoutException.class);
        assertThat(((RenderTimeoutException) reported.getValue()).getFrame()).isEqualTo(12);
        assertThat(pool.availableCount()).isEqualTo(1);
        assertThat(renderFailure).isCompletedExceptionally();
        assertThatThrownBy(renderFailure::join).hasCauseInstanceOf(RenderTimeoutException.class);
        assertThat(worker.captures).isEmpty();
        verify(callbacks, never()).onFrameUpdate(anyInt(), any(), anyInt());
    }

    @Test
    void runReportsOtherSeekFailuresWithFrame() {
        worker.seekBehaviour = frame -> CompletableFuture.failedFuture(new IllegalStateException("page crashed"));

        CompletableFuture<List<RenderAsset>> result = task(4, ImageFormat.JPEG, null).run();

        assertThatThrownBy(result::join)
                .hasCauseInstanceOf(FrameRenderException.class)
                .hasMessageContaining("page crashed");

        ArgumentCaptor<Throwable> reported = ArgumentCaptor.forClass(Throwable.class);
        verify(callbacks).onError(reported.capture(), eq(4));
        assertThat(reported.getValue())
                .isInstanceOf(FrameRenderException.class)
                .isNotInstanceOf(RenderTimeoutException.class);
        assertThat(reported.getValue().getCause()).hasMessage("page crashed");
        assertThat(pool.availableCount()).isEqualTo(1);
    }

    @Test
    void runReportsPageErrorsRaisedWhileRendering() {
        PageErrorException pageError = new PageErrorException("ReferenceError: x is not defined");
        worker.seekBehaviour = frame -> {
            worker.emitPageError(pageError);
            return CompletableFuture.completedFuture(null);
        };

        task(8, ImageFormat.JPEG, null).run().join();
        worker.emitPageError(new PageErrorException("after release"));

        verify(callbacks).onError(pageError, 8);
        verify(callbacks).onError(any(), anyInt());
    }

    @Test
    void runReleasesWorkerWithoutRenderingWhenAborted() {
        FrameRenderTask task = new FrameRenderTask(1, OUTPUT, ImageFormat.JPEG, null, pool, framesRendered, callbacks,
                CompletableFuture.failedFuture(new IllegalStateException("frame 0 failed")));

        assertThatThrownBy(() -> task.run().join())
                .isInstanceOfAny(CompletionException.class, CancellationException.class);
        assertThat(worker.seekedFrames).isEmpty();
        assertThat(pool.availableCount()).isEqualTo(1);
        verify(callbacks, never()).onError(any(), any());
    }

    @Test
    void isTimeoutRecognizesTimeoutExceptionsInCauseChain() {
        assertThat(FrameRenderTask.isTimeout(new RuntimeException("wrapped", new TimeoutException("late")))).isTrue();
        assertThat(FrameRenderTask.isTimeout(new RuntimeException("Waiting failed: Timeout 30000ms Exceeded"))).isTrue();
        assertThat(FrameRenderTask.isTimeout(new RuntimeException("timeout"))).isFalse();
        assertThat(FrameRenderTask.isTimeout(new RuntimeException((String) null))).isFalse();
    }

    private FrameRenderTask task(int frame, ImageFormat format, Integer quality) {
        return new FrameRenderTask(frame, OUTPUT, format, quality, pool, framesRendered, callbacks, renderFailure);
    }
}
