package github.sarthakdev143.frame_factory.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

@Component
@ConditionalOnProperty(name = "frame-factory.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private final RendererProperties properties;

    public StartupPreflightChecks(RendererProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkOutputRoot();
        checkWorkerBaseUrl();
    }

    void checkOutputRoot() {
        Path outputRoot = properties.getOutputRoot();
        if (outputRoot == null) {
            throw new IllegalStateException("frame-factory.renderer.output-root must be set.");
        }

        try {
            Files.createDirectories(outputRoot);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Render output root " + outputRoot.toAbsolutePath() + " cannot be created.",
                    e);
        }

        if (!Files.isWritable(outputRoot)) {
            throw new IllegalStateException(
                    "Render output root " + outputRoot.toAbsolutePath() + " is not writable.");
        }
    }

    void checkWorkerBaseUrl() {
        String workerBaseUrl = properties.getWorkerBaseUrl();
        if (workerBaseUrl == null || workerBaseUrl.isBlank()) {
            throw new IllegalStateException("frame-factory.renderer.worker-base-url must be set.");
        }

        URI uri;
        try {
            uri = new URI(workerBaseUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Worker base URL " + workerBaseUrl + " is not a valid URI.", e);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || uri.getHost() == null || !(scheme.equals("http") || scheme.equals("https"))) {
            throw new IllegalStateException(
                    "Worker base URL " + workerBaseUrl + " must be an absolute http or https URL.");
        }
    }
}
