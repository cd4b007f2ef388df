package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.ImageFormat;
import github.sarthakdev143.frame_factory.model.asset.RenderAsset;
import github.sarthakdev143.frame_factory.render.pool.WorkerPool;
import github.sarthakdev143.frame_factory.render.worker.FrameWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Renders a single planned frame on a pooled worker: seek, capture, collect assets, release.
 *
 * <p>A failing task completes {@code renderFailure} with its error before giving its worker
 * back, so the render fails with that error and tasks still waiting for a worker give up
 * instead of rendering frames nobody will use.
 */
final class FrameRenderTask {

    private static final Logger logger = LoggerFactory.getLogger(FrameRenderTask.class);

    private final int frame;
    private final Path output;
    private final ImageFormat imageFormat;
    private final Integer quality;
    private final WorkerPool<FrameWorker> pool;
    private final AtomicInteger framesRendered;
    private final RenderCallbacks callbacks;
    private final CompletableFuture<?> renderFailure;

    FrameRenderTask(
            int frame,
            Path output,
            ImageFormat imageFormat,
            Integer quality,
            WorkerPool<FrameWorker> pool,
            AtomicInteger framesRendered,
            RenderCallbacks callbacks,
            CompletableFuture<?> renderFailure) {
        this.frame = frame;
        this.output = output;
        this.imageFormat = imageFormat;
        this.quality = quality;
        this.pool = pool;
        this.framesRendered = framesRendered;
        this.callbacks = callbacks;
        this.renderFailure = renderFailure;
    }

    CompletableFuture<List<RenderAsset>> run() {
        return pool.acquire().thenCompose(this::renderOn);
    }

    private CompletableFuture<List<RenderAsset>> renderOn(FrameWorker worker) {
        if (renderFailure.isDone()) {
            pool.release(worker);
            return CompletableFuture.failedFuture(
                    new CancellationException("Render aborted before frame " + frame + " started."));
        }

        Consumer<Throwable> pageErrorObserver = error -> callbacks.onError(error, frame);
        worker.addErrorListener(pageErrorObserver);

        CompletableFuture<List<RenderAsset>> collected;
        try {
            collected = worker.seekToFrame(frame)
                    .handle((ignored, error) -> {
                        if (error != null) {
                            throw new CompletionException(classifySeekFailure(unwrap(error)));
                        }
                        return ignored;
                    })
                    .thenCompose(ignored -> capture(worker))
                    .thenCompose(ignored -> worker.collectAssets());
        } catch (RuntimeException e) {
            collected = CompletableFuture.failedFuture(e);
        }

        return collected.handle((assets, error) -> {
            worker.removeErrorListener(pageErrorObserver);
            if (error != null) {
                RuntimeException failure = asFrameFailure(unwrap(error));
                renderFailure.completeExceptionally(failure);
                callbacks.onError(failure, frame);
                pool.release(worker);
                throw new CompletionException(failure);
            }

            pool.release(worker);
            int count = framesRendered.incrementAndGet();
            logger.debug("Rendered frame {} ({} done) to {}", frame, count, output);
            callbacks.onFrameUpdate(count, output, frame);
            return assets == null ? List.<RenderAsset>of() : assets;
        });
    }

    private CompletableFuture<Void> capture(FrameWorker worker) {
        if (!imageFormat.producesImages()) {
            return CompletableFuture.completedFuture(null);
        }
        return worker.captureFrame(imageFormat, imageFormat.isLossy() ? quality : null, output);
    }

    private RuntimeException classifySeekFailure(Throwable error) {
        if (isTimeout(error)) {
            return new RenderTimeoutException(frame, error);
        }
        return new FrameRenderException(frame, error);
    }

    private RuntimeException asFrameFailure(Throwable error) {
        if (error instanceof RenderTimeoutException || error instanceof FrameRenderException) {
            return (RuntimeException) error;
        }
        return new FrameRenderException(frame, error);
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String normalized = message.toLowerCase(Locale.ROOT);
                if (normalized.contains("timeout") && normalized.contains("exceeded")) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
