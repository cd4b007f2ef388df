package github.sarthakdev143.frame_factory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Connection to the page automation sidecar and defaults for render jobs.
 */
@ConfigurationProperties(prefix = "frame-factory.renderer")
public class RendererProperties {

    private String workerBaseUrl = "http://localhost:3100";
    private Duration seekTimeout = Duration.ofSeconds(30);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private Path outputRoot = Path.of("out");
    private Integer defaultConcurrency;
    private int jobThreads = 2;

    public String getWorkerBaseUrl() {
        return workerBaseUrl;
    }

    public void setWorkerBaseUrl(String workerBaseUrl) {
        this.workerBaseUrl = workerBaseUrl;
    }

    public Duration getSeekTimeout() {
        return seekTimeout;
    }

    public void setSeekTimeout(Duration seekTimeout) {
        this.seekTimeout = seekTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    public void setOutputRoot(Path outputRoot) {
        this.outputRoot = outputRoot;
    }

    /**
     * Workers per render when a job does not ask for a number, {@code null} to detect from the machine.
     */
    public Integer getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public void setDefaultConcurrency(Integer defaultConcurrency) {
        this.defaultConcurrency = defaultConcurrency;
    }

    public int getJobThreads() {
        return jobThreads;
    }

    public void setJobThreads(int jobThreads) {
        this.jobThreads = jobThreads;
    }
}
