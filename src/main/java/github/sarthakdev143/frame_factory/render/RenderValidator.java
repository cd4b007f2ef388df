package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.CompositionConfig;
import github.sarthakdev143.frame_factory.model.ImageFormat;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class RenderValidator {

    private static final int MIN_QUALITY = 0;
    private static final int MAX_QUALITY = 100;
    private static final String CONTEXT = "in the composition passed to renderFrames()";

    public void validate(RenderFramesRequest request) {
        if (request == null) {
            throw new RenderConfigurationException("A render request is required.");
        }

        validateComposition(request.composition());
        validateImageOptions(request.imageFormat(), request.quality());
        FramePlanner.validateFrameRange(request.composition().durationInFrames(), request.frameRange());

        if (request.compositionId() == null || request.compositionId().isBlank()) {
            throw new RenderConfigurationException("compositionId is required.");
        }
        if (request.serveUrl() == null || request.serveUrl().isBlank()) {
            throw new RenderConfigurationException("serveUrl is required.");
        }
        validateOutputDir(request.outputDir(), request.imageFormat());
    }

    public void validateComposition(CompositionConfig composition) {
        if (composition == null) {
            throw new RenderConfigurationException("A composition is required.");
        }
        validateDimension(composition.width(), "width");
        validateDimension(composition.height(), "height");

        double fps = composition.fps();
        if (!Double.isFinite(fps) || fps <= 0) {
            throw new RenderConfigurationException(
                    "\"fps\" must be positive, but got " + fps + " " + CONTEXT + ".");
        }

        if (composition.durationInFrames() <= 0) {
            throw new RenderConfigurationException(
                    "durationInFrames must be positive, but got " + composition.durationInFrames() + " " + CONTEXT + ".");
        }
    }

    public void validateImageOptions(ImageFormat imageFormat, Integer quality) {
        if (quality == null) {
            return;
        }
        if (imageFormat == null || !imageFormat.isLossy()) {
            throw new RenderConfigurationException("You can only pass the `quality` option if `imageFormat` is 'jpeg'.");
        }
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new RenderConfigurationException(
                    "Quality option must be between " + MIN_QUALITY + " and " + MAX_QUALITY + ", but got " + quality + ".");
        }
    }

    private void validateDimension(int value, String name) {
        if (value <= 0) {
            throw new RenderConfigurationException(
                    "The \"" + name + "\" prop must be positive, but got " + value + " " + CONTEXT + ".");
        }
    }

    private void validateOutputDir(Path outputDir, ImageFormat imageFormat) {
        if (outputDir == null) {
            throw new RenderConfigurationException("outputDir is required.");
        }
        if (!imageFormat.producesImages()) {
            return;
        }

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new RenderConfigurationException("outputDir " + outputDir.toAbsolutePath() + " cannot be created: " + e.getMessage());
        }
        if (!Files.isWritable(outputDir)) {
            throw new RenderConfigurationException("outputDir " + outputDir.toAbsolutePath() + " is not writable.");
        }
    }
}
