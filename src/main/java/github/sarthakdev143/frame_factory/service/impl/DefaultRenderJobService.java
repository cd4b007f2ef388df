package github.sarthakdev143.frame_factory.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import github.sarthakdev143.frame_factory.assets.AssetPositionCalculator;
import github.sarthakdev143.frame_factory.config.RendererProperties;
import github.sarthakdev143.frame_factory.dto.RenderJobRequest;
import github.sarthakdev143.frame_factory.model.CompositionConfig;
import github.sarthakdev143.frame_factory.model.FrameRange;
import github.sarthakdev143.frame_factory.model.ImageFormat;
import github.sarthakdev143.frame_factory.model.RenderJobState;
import github.sarthakdev143.frame_factory.model.RenderJobStatus;
import github.sarthakdev143.frame_factory.model.asset.AssetSpan;
import github.sarthakdev143.frame_factory.render.FrameRenderer;
import github.sarthakdev143.frame_factory.render.RenderCallbacks;
import github.sarthakdev143.frame_factory.render.RenderFramesOutput;
import github.sarthakdev143.frame_factory.render.RenderFramesRequest;
import github.sarthakdev143.frame_factory.render.RenderTimeoutException;
import github.sarthakdev143.frame_factory.render.RenderValidator;
import github.sarthakdev143.frame_factory.service.RenderJobService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultRenderJobService implements RenderJobService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultRenderJobService.class);

    private final FrameRenderer frameRenderer;
    private final AssetPositionCalculator assetPositionCalculator;
    private final RenderValidator renderValidator;
    private final RendererProperties properties;
    private final TaskExecutor taskExecutor;
    private final Map<String, RenderJobStatus> jobs = new ConcurrentHashMap<>();
    private final Counter rendersStartedCounter;
    private final Counter timeoutFailureCounter;
    private final Counter errorFailureCounter;
    private final Counter framesRenderedCounter;

    public DefaultRenderJobService(
            FrameRenderer frameRenderer,
            AssetPositionCalculator assetPositionCalculator,
            RenderValidator renderValidator,
            RendererProperties properties,
            @Qualifier("renderTaskExecutor") TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.frameRenderer = frameRenderer;
        this.assetPositionCalculator = assetPositionCalculator;
        this.renderValidator = renderValidator;
        this.properties = properties;
        this.taskExecutor = taskExecutor;
        this.rendersStartedCounter = meterRegistry.counter("frame_factory.renders.started");
        this.timeoutFailureCounter = meterRegistry.counter("frame_factory.renders.failed", "reason", "timeout");
        this.errorFailureCounter = meterRegistry.counter("frame_factory.renders.failed", "reason", "error");
        this.framesRenderedCounter = meterRegistry.counter("frame_factory.frames.rendered");
    }

    @Override
    public String submitRender(RenderJobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("A render request body is required.");
        }

        String jobId = UUID.randomUUID().toString();
        RenderFramesRequest renderRequest = toRenderFramesRequest(jobId, request);
        renderValidator.validate(renderRequest);

        Instant now = Instant.now();
        jobs.put(jobId, new RenderJobStatus(
                jobId,
                RenderJobState.QUEUED,
                "Render job queued.",
                now,
                now,
                renderRequest.compositionId(),
                null,
                0,
                null,
                List.of(),
                null));

        logger.info(
                "Accepted render job {} compositionId={} durationInFrames={} frameRange={} imageFormat={}",
                jobId,
                renderRequest.compositionId(),
                renderRequest.composition().durationInFrames(),
                renderRequest.frameRange(),
                renderRequest.imageFormat());

        taskExecutor.execute(() -> processJob(jobId, renderRequest));
        return jobId;
    }

    @Override
    public Optional<RenderJobStatus> getJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Runs on a {@code renderTaskExecutor} thread until the render has finished and its assets
     * are stitched, so the executor's thread count bounds how many renders run at once.
     */
    private void processJob(String jobId, RenderFramesRequest request) {
        updateJobState(jobId, RenderJobState.RENDERING, "Opening workers.");
        rendersStartedCounter.increment();

        StitchedRender result;
        try {
            RenderFramesOutput output = frameRenderer.renderFrames(request, new JobCallbacks(jobId)).join();
            result = new StitchedRender(output.frameCount(), assetPositionCalculator.calculate(output.frameAssets()));
        } catch (RuntimeException e) {
            markJobFailed(jobId, e);
            return;
        }

        markJobCompleted(jobId, result);
        logger.info(
                "Completed render job {} frameCount={} assets={} outputDir={}",
                jobId,
                result.frameCount(),
                result.assets().size(),
                request.outputDir());
    }

    RenderFramesRequest toRenderFramesRequest(String jobId, RenderJobRequest request) {
        CompositionConfig composition = new CompositionConfig(
                require(request.width(), "width"),
                require(request.height(), "height"),
                require(request.fps(), "fps"),
                require(request.durationInFrames(), "durationInFrames"));

        Integer concurrency = request.concurrency() != null
                ? request.concurrency()
                : properties.getDefaultConcurrency();

        return new RenderFramesRequest(
                composition,
                request.compositionId(),
                request.serveUrl(),
                resolveOutputDir(jobId, request.outputDir()),
                ImageFormat.fromInput(request.imageFormat()),
                request.quality(),
                parseFrameRange(request.frameRange()),
                concurrency,
                request.inputProps(),
                request.envVariables());
    }

    FrameRange parseFrameRange(JsonNode frameRange) {
        if (frameRange == null || frameRange.isNull() || frameRange.isMissingNode()) {
            return null;
        }
        if (isFrameNumber(frameRange)) {
            return FrameRange.single(frameRange.intValue());
        }
        if (frameRange.isArray()
                && frameRange.size() == 2
                && isFrameNumber(frameRange.get(0))
                && isFrameNumber(frameRange.get(1))) {
            return FrameRange.between(frameRange.get(0).intValue(), frameRange.get(1).intValue());
        }
        throw new IllegalArgumentException("frameRange must be a frame number or a [start, end] pair of frame numbers.");
    }

    private boolean isFrameNumber(JsonNode node) {
        return node.isIntegralNumber() && node.canConvertToInt();
    }

    private Path resolveOutputDir(String jobId, String requestedOutputDir) {
        Path outputRoot = properties.getOutputRoot().toAbsolutePath().normalize();
        if (requestedOutputDir == null || requestedOutputDir.isBlank()) {
            return outputRoot.resolve(jobId);
        }

        Path outputDir = outputRoot.resolve(requestedOutputDir.trim()).normalize();
        if (!outputDir.startsWith(outputRoot)) {
            throw new IllegalArgumentException("outputDir must stay inside the output root.");
        }
        return outputDir;
    }

    private <T> T require(T value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " is required.");
        }
        return value;
    }

    private void updateJobState(String jobId, RenderJobState state, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.compositionId(),
                current.frameCount(),
                current.framesRendered(),
                current.lastFramePath(),
                current.assets(),
                current.errorMessage()));
    }

    private void markJobStarted(String jobId, int frameCount) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.RENDERING,
                "Rendering " + frameCount + " frames.",
                current.createdAt(),
                Instant.now(),
                current.compositionId(),
                frameCount,
                current.framesRendered(),
                current.lastFramePath(),
                current.assets(),
                current.errorMessage()));
    }

    private void markFrameRendered(String jobId, int framesRendered, Path output) {
        jobs.computeIfPresent(jobId, (ignored, current) -> {
            if (current.state() != RenderJobState.RENDERING || framesRendered <= current.framesRendered()) {
                return current;
            }
            return new RenderJobStatus(
                    current.jobId(),
                    current.state(),
                    current.message(),
                    current.createdAt(),
                    Instant.now(),
                    current.compositionId(),
                    current.frameCount(),
                    framesRendered,
                    output.toString(),
                    current.assets(),
                    current.errorMessage());
        });
    }

    private void markJobCompleted(String jobId, StitchedRender result) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.COMPLETED,
                "Rendered " + result.frameCount() + " frames.",
                current.createdAt(),
                Instant.now(),
                current.compositionId(),
                result.frameCount(),
                Math.max(current.framesRendered(), result.frameCount()),
                current.lastFramePath(),
                result.assets(),
                null));
    }

    private void markJobFailed(String jobId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RenderTimeoutException) {
            timeoutFailureCounter.increment();
        } else {
            errorFailureCounter.increment();
        }
        logger.error("Render job {} failed", jobId, cause);

        String errorMessage = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.FAILED,
                "Render failed. Check server logs.",
                current.createdAt(),
                Instant.now(),
                current.compositionId(),
                current.frameCount(),
                current.framesRendered(),
                current.lastFramePath(),
                current.assets(),
                errorMessage));
    }

    private record StitchedRender(int frameCount, List<AssetSpan> assets) {
    }

    private final class JobCallbacks implements RenderCallbacks {

        private final String jobId;

        private JobCallbacks(String jobId) {
            this.jobId = jobId;
        }

        @Override
        public void onStart(int frameCount) {
            markJobStarted(jobId, frameCount);
        }

        @Override
        public void onFrameUpdate(int framesRendered, Path output, int frame) {
            framesRenderedCounter.increment();
            markFrameRendered(jobId, framesRendered, output);
        }

        @Override
        public void onError(Throwable error, Integer frame) {
            if (frame == null) {
                logger.error("Render job {} reported an error before a frame was assigned", jobId, error);
            } else {
                logger.error("Render job {} reported an error on frame {}", jobId, frame, error);
            }
        }
    }
}
