package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.CompositionConfig;
import github.sarthakdev143.frame_factory.model.FrameRange;
import github.sarthakdev143.frame_factory.model.ImageFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderValidatorTest {

    private final RenderValidator validator = new RenderValidator();

    @TempDir
    Path tempDir;

    @Test
    void validateAcceptsJpegWithQuality() {
        assertThatCode(() -> validator.validate(request(new CompositionConfig(1920, 1080, 30, 90), ImageFormat.JPEG, 80, null)))
                .doesNotThrowAnyException();
    }

    @Test
    void validateRejectsQualityWithLosslessFormat() {
        assertThatThrownBy(() -> validator.validate(request(new CompositionConfig(1920, 1080, 30, 90), ImageFormat.PNG, 80, null)))
                .isInstanceOf(RenderConfigurationException.class)
                .hasMessageContaining("quality");
        assertThatThrownBy(() -> validator.validate(request(new CompositionConfig(1920, 1080, 30, 90), ImageFormat.NONE, 50, null)))
                .isInstanceOf(RenderConfigurationException.class);
    }

    @Test
    void validateRejectsQualityOutOfBounds() {
        assertThatThrownBy(() -> validator.validateImageOptions(ImageFormat.JPEG, 101))
                .isInstanceOf(RenderConfigurationException.class);
    }

    @Test
    void validateRejectsInvalidComposition() {
        assertThatThrownBy(() -> validator.validateComposition(new CompositionConfig(0, 1080, 30, 90)))
                .isInstanceOf(RenderConfigurationException.class)
                .hasMessageContaining("width");
        assertThatThrownBy(() -> validator.validateComposition(new CompositionConfig(1920, -1, 30, 90)))
                .isInstanceOf(RenderConfigurationException.class)
                .hasMessageContaining("height");
        assertThatThrownBy(() -> validator.validateComposition(new CompositionConfig(1920, 1080, 0, 90)))
                .isInstanceOf(RenderConfigurationException.class)
                .hasMessageContaining("fps");
        assertThatThrownBy(() -> validator.validateComposition(new CompositionConfig(1920, 1080, Double.NaN, 90)))
                .isInstanceOf(RenderConfigurationException.class);
        assertThatThrownBy(() -> validator.validateComposition(new CompositionConfig(1920, 1080, 30, 0)))
                .isInstanceOf(RenderConfigurationException.class)
                .hasMessageContaining("durationInFrames");
    }

    @Test
    void validateRejectsFrameRangeOutsideComposition() {
        assertThatThrownBy(() -> validator.validate(
                request(new CompositionConfig(100, 100, 30, 10), ImageFormat.PNG, null, FrameRange.between(5, 10))))
                .isInstanceOf(RenderConfigurationException.class);
    }

    @Test
    void validateCreatesOutputDirectoryForImageFormats() {
        Path outputDir = tempDir.resolve("nested/frames");

        validator.validate(new RenderFramesRequest(
                new CompositionConfig(100, 100, 30, 10),
                "my-comp",
                "http://localhost:3000",
                outputDir,
                ImageFormat.PNG,
                null,
                null,
                1,
                null,
                Map.of()));

        assertThat(Files.isDirectory(outputDir)).isTrue();
    }

    private RenderFramesRequest request(CompositionConfig composition, ImageFormat format, Integer quality, FrameRange range) {
        return new RenderFramesRequest(
                composition,
                "my-comp",
                "http://localhost:3000",
                tempDir,
                format,
                quality,
                range,
                1,
                null,
                Map.of());
    }
}
