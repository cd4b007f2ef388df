package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.CompositionConfig;
import github.sarthakdev143.frame_factory.model.asset.RenderAsset;
import github.sarthakdev143.frame_factory.render.pool.WorkerPool;
import github.sarthakdev143.frame_factory.render.worker.FrameWorker;
import github.sarthakdev143.frame_factory.render.worker.FrameWorkerFactory;
import github.sarthakdev143.frame_factory.render.worker.WorkerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Renders the planned frames of a composition on a pool of workers.
 *
 * <p>Every frame gets its own task and all tasks are started at once; the pool is the only
 * admission control. Each task stores its assets in the slot of its plan position, so the
 * result is ordered by frame whatever order the tasks finish in. The returned future fails
 * with the first task failure, which the failing task records before releasing its worker. Tasks already running are left to finish and workers are
 * closed once every task has settled.
 */
@Component
public class FrameRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FrameRenderer.class);

    private final FrameWorkerFactory workerFactory;
    private final RenderValidator validator;
    private final ConcurrencyResolver concurrencyResolver;

    public FrameRenderer(
            FrameWorkerFactory workerFactory,
            RenderValidator validator,
            ConcurrencyResolver concurrencyResolver) {
        this.workerFactory = workerFactory;
        this.validator = validator;
        this.concurrencyResolver = concurrencyResolver;
    }

    /**
     * @throws RenderConfigurationException synchronously, before any worker is opened
     */
    public CompletableFuture<RenderFramesOutput> renderFrames(RenderFramesRequest request, RenderCallbacks callbacks) {
        validator.validate(request);
        RenderCallbacks safeCallbacks = callbacks == null ? RenderCallbacks.none() : callbacks;

        CompositionConfig composition = request.composition();
        FramePlan plan = FramePlanner.plan(composition.durationInFrames(), request.frameRange());
        int concurrency = concurrencyResolver.resolve(request.concurrency());

        WorkerSession session = new WorkerSession(
                request.serveUrl(),
                request.compositionId(),
                composition.width(),
                composition.height(),
                request.inputProps(),
                request.envVariables(),
                FramePlanner.initialFrame(request.frameRange()));

        logger.info(
                "Rendering {} frames of composition {} with {} workers imageFormat={}",
                plan.frameCount(),
                request.compositionId(),
                concurrency,
                request.imageFormat());

        return openWorkers(session, concurrency, safeCallbacks)
                .thenCompose(workers -> renderOnPool(request, plan, new WorkerPool<>(workers), safeCallbacks));
    }

    private CompletableFuture<List<FrameWorker>> openWorkers(
            WorkerSession session,
            int concurrency,
            RenderCallbacks callbacks) {
        List<CompletableFuture<FrameWorker>> opening = new ArrayList<>(concurrency);
        for (int index = 0; index < concurrency; index++) {
            opening.add(workerFactory.open(session, error -> callbacks.onError(error, null)));
        }

        return CompletableFuture.allOf(opening.toArray(CompletableFuture[]::new))
                .handle((ignored, error) -> {
                    List<FrameWorker> opened = new ArrayList<>(concurrency);
                    for (CompletableFuture<FrameWorker> future : opening) {
                        if (!future.isCompletedExceptionally()) {
                            opened.add(future.join());
                        }
                    }
                    if (error != null) {
                        closeWorkers(opened);
                        callbacks.onError(FrameRenderTask.unwrap(error), null);
                        throw new CompletionException(FrameRenderTask.unwrap(error));
                    }
                    return opened;
                });
    }

    private CompletableFuture<RenderFramesOutput> renderOnPool(
            RenderFramesRequest request,
            FramePlan plan,
            WorkerPool<FrameWorker> pool,
            RenderCallbacks callbacks) {
        int frameCount = plan.frameCount();
        callbacks.onStart(frameCount);

        AtomicReferenceArray<List<RenderAsset>> frameAssets = new AtomicReferenceArray<>(frameCount);
        AtomicInteger framesRendered = new AtomicInteger();
        CompletableFuture<RenderFramesOutput> result = new CompletableFuture<>();

        List<CompletableFuture<Void>> tasks = new ArrayList<>(frameCount);
        for (int index = 0; index < frameCount; index++) {
            int slot = index;
            int frame = plan.frameAt(index);
            Path output = request.outputDir().resolve(plan.fileNameFor(frame, request.imageFormat()));
            FrameRenderTask task = new FrameRenderTask(
                    frame,
                    output,
                    request.imageFormat(),
                    request.quality(),
                    pool,
                    framesRendered,
                    callbacks,
                    result);

            tasks.add(task.run()
                    .thenAccept(assets -> frameAssets.set(slot, assets))
                    .whenComplete((ignored, error) -> {
                        Throwable cause = error == null ? null : FrameRenderTask.unwrap(error);
                        // Skipped tasks only follow a failure that already completed the result.
                        if (cause != null && !(cause instanceof CancellationException)) {
                            result.completeExceptionally(cause);
                        }
                    }));
        }

        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .whenComplete((ignored, error) -> {
                    closeWorkers(pool.workers());
                    if (error == null) {
                        List<List<RenderAsset>> ordered = new ArrayList<>(frameCount);
                        for (int index = 0; index < frameCount; index++) {
                            ordered.add(frameAssets.get(index));
                        }
                        result.complete(new RenderFramesOutput(frameCount, ordered));
                    }
                });

        return result;
    }

    private void closeWorkers(List<FrameWorker> workers) {
        for (FrameWorker worker : workers) {
            try {
                worker.close().whenComplete((ignored, error) -> {
                    if (error != null) {
                        logger.warn("Failed to close worker {}", worker.id(), error);
                    }
                });
            } catch (RuntimeException e) {
                logger.warn("Failed to close worker {}", worker.id(), e);
            }
        }
    }
}
