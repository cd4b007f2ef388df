package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.CompositionConfig;
import github.sarthakdev143.frame_factory.model.FrameRange;
import github.sarthakdev143.frame_factory.model.ImageFormat;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything one invocation of {@link FrameRenderer#renderFrames} needs.
 *
 * @param frameRange  frames to render, {@code null} renders the whole composition
 * @param quality     JPEG quality, only legal with {@link ImageFormat#JPEG}
 * @param concurrency requested number of workers, {@code null} to detect from the machine
 * @param inputProps  opaque value forwarded to every worker
 */
public record RenderFramesRequest(
        CompositionConfig composition,
        String compositionId,
        String serveUrl,
        Path outputDir,
        ImageFormat imageFormat,
        Integer quality,
        FrameRange frameRange,
        Integer concurrency,
        Object inputProps,
        Map<String, String> envVariables) {

    public RenderFramesRequest {
        imageFormat = imageFormat == null ? ImageFormat.JPEG : imageFormat;
        if (envVariables == null) {
            envVariables = Map.of();
        } else {
            envVariables.forEach((key, value) -> {
                if (value == null) {
                    throw new RenderConfigurationException("envVariables value for " + key + " must not be null.");
                }
            });
            envVariables = Map.copyOf(envVariables);
        }
    }
}
