package github.sarthakdev143.frame_factory.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StartupPreflightChecksTest {

    @TempDir
    Path tempDir;

    @Test
    void checkOutputRootCreatesMissingDirectory() {
        RendererProperties properties = new RendererProperties();
        properties.setOutputRoot(tempDir.resolve("renders/out"));

        new StartupPreflightChecks(properties).checkOutputRoot();

        assertThat(Files.isDirectory(tempDir.resolve("renders/out"))).isTrue();
    }

    @Test
    void checkOutputRootFailsWhenPathIsAFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("taken"), "not a directory");
        RendererProperties properties = new RendererProperties();
        properties.setOutputRoot(file);

        assertThatThrownBy(() -> new StartupPreflightChecks(properties).checkOutputRoot())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot be created");
    }

    @Test
    void checkWorkerBaseUrlAcceptsHttpUrl() {
        RendererProperties properties = new RendererProperties();
        properties.setWorkerBaseUrl("http://render-sidecar:3100");

        assertThatCode(() -> new StartupPreflightChecks(properties).checkWorkerBaseUrl()).doesNotThrowAnyException();
    }

    @Test
    void checkWorkerBaseUrlRejectsNonHttpUrls() {
        RendererProperties properties = new RendererProperties();
        properties.setWorkerBaseUrl("ftp://render-sidecar");

        assertThatThrownBy(() -> new StartupPreflightChecks(properties).checkWorkerBaseUrl())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("absolute http or https URL");
    }

    @Test
    void checkWorkerBaseUrlRejectsBlankValue() {
        RendererProperties properties = new RendererProperties();
        properties.setWorkerBaseUrl(" ");

        assertThatThrownBy(() -> new StartupPreflightChecks(properties).checkWorkerBaseUrl())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must be set");
    }
}
