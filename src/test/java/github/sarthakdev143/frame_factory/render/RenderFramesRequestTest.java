package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.CompositionConfig;
import github.sarthakdev143.frame_factory.model.ImageFormat;
import github.sarthakdev143.frame_factory.render.worker.WorkerSession;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderFramesRequestTest {

    @Test
    void nullEnvVariableValueIsRejectedAsConfigurationError() {
        Map<String, String> envVariables = new HashMap<>();
        envVariables.put("API_URL", null);

        assertThatThrownBy(() -> request(envVariables))
                .isInstanceOf(RenderConfigurationException.class)
                .hasMessage("envVariables value for API_URL must not be null.");
    }

    @Test
    void missingEnvVariablesAndFormatFallBackToDefaults() {
        RenderFramesRequest request = request(null);

        assertThat(request.envVariables()).isEmpty();
        assertThat(request.imageFormat()).isEqualTo(ImageFormat.JPEG);
    }

    @Test
    void workerSessionRejectsNullEnvVariableValue() {
        Map<String, String> envVariables = new HashMap<>();
        envVariables.put("API_URL", null);

        assertThatThrownBy(() -> new WorkerSession("http://localhost:3000", "intro", 640, 360, null, envVariables, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("API_URL");
    }

    private static RenderFramesRequest request(Map<String, String> envVariables) {
        return new RenderFramesRequest(
                new CompositionConfig(640, 360, 30, 10),
                "intro",
                "http://localhost:3000",
                Path.of("out"),
                null,
                null,
                null,
                null,
                null,
                envVariables);
    }
}
