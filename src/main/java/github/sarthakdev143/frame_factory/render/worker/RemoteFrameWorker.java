package github.sarthakdev143.frame_factory.render.worker;

import github.sarthakdev143.frame_factory.model.ImageFormat;
import github.sarthakdev143.frame_factory.model.asset.RenderAsset;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClientRequest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Page hosted by the automation sidecar, addressed through its session id.
 */
public class RemoteFrameWorker implements FrameWorker {

    private static final Logger logger = LoggerFactory.getLogger(RemoteFrameWorker.class);

    private final WebClient client;
    private final String sessionId;
    private final Duration seekTimeout;
    private final Duration requestTimeout;
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

    RemoteFrameWorker(WebClient client, String sessionId, Duration seekTimeout, Duration requestTimeout) {
        this.client = client;
        this.sessionId = sessionId;
        this.seekTimeout = seekTimeout;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String id() {
        return sessionId;
    }

    @Override
    public CompletableFuture<Void> seekToFrame(int frame) {
        return client.post()
                .uri("/sessions/{sessionId}/seek", sessionId)
                .httpRequest(this::applySeekResponseTimeout)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new WorkerMessages.SeekRequest(frame))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure(response, sessionId, "seek to frame " + frame))
                .bodyToMono(WorkerMessages.PageResponse.class)
                .timeout(seekTimeout)
                .onErrorMap(RemoteFrameWorker::isSeekDeadline, e -> new WorkerRequestException(
                        "Navigation timeout of " + seekTimeout.toMillis() + " ms exceeded while seeking to frame " + frame,
                        e))
                .doOnNext(response -> dispatchPageErrors(response.pageErrors()))
                .then()
                .toFuture();
    }

    @Override
    public CompletableFuture<Void> captureFrame(ImageFormat format, Integer quality, Path output) {
        Flux<DataBuffer> image = client.post()
                .uri("/sessions/{sessionId}/screenshot", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(new WorkerMessages.ScreenshotRequest(format.extension(), format.isLossy() ? quality : null))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure(response, sessionId, "capture " + output.getFileName()))
                .bodyToFlux(DataBuffer.class);

        return DataBufferUtils.write(image, output)
                .timeout(requestTimeout)
                .onErrorMap(TimeoutException.class, e -> new WorkerRequestException(
                        "Capturing " + output.getFileName() + " did not finish within " + requestTimeout.toMillis() + " ms",
                        e))
                .toFuture();
    }

    @Override
    public CompletableFuture<List<RenderAsset>> collectAssets() {
        return client.get()
                .uri("/sessions/{sessionId}/assets", sessionId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure(response, sessionId, "collect assets"))
                .bodyToMono(WorkerMessages.AssetsResponse.class)
                .timeout(requestTimeout)
                .doOnNext(response -> dispatchPageErrors(response.pageErrors()))
                .map(response -> response.assets() == null ? List.<RenderAsset>of() : List.copyOf(response.assets()))
                .defaultIfEmpty(List.of())
                .toFuture();
    }

    @Override
    public void addErrorListener(Consumer<Throwable> listener) {
        errorListeners.add(listener);
    }

    @Override
    public void removeErrorListener(Consumer<Throwable> listener) {
        errorListeners.remove(listener);
    }

    @Override
    public CompletableFuture<Void> close() {
        errorListeners.clear();
        return client.delete()
                .uri("/sessions/{sessionId}", sessionId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure(response, sessionId, "close"))
                .bodyToMono(Void.class)
                .timeout(requestTimeout)
                .doOnSuccess(ignored -> logger.debug("Closed worker session {}", sessionId))
                .toFuture();
    }

    @Override
    public String toString() {
        return "RemoteFrameWorker[" + sessionId + "]";
    }

    // The client-wide response timeout follows request-timeout, which may be shorter or longer than a seek.
    private void applySeekResponseTimeout(ClientHttpRequest request) {
        Object nativeRequest = request.getNativeRequest();
        if (nativeRequest instanceof HttpClientRequest) {
            ((HttpClientRequest) nativeRequest).responseTimeout(seekTimeout);
        }
    }

    static boolean isSeekDeadline(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException || current instanceof ReadTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private void dispatchPageErrors(List<String> pageErrors) {
        if (pageErrors == null || pageErrors.isEmpty()) {
            return;
        }
        for (String pageError : pageErrors) {
            PageErrorException error = new PageErrorException(pageError);
            for (Consumer<Throwable> listener : errorListeners) {
                listener.accept(error);
            }
        }
    }

    static Mono<WorkerRequestException> failure(ClientResponse response, String sessionId, String action) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new WorkerRequestException(
                        "Worker " + sessionId + " failed to " + action
                                + " with status " + response.statusCode().value() + ": " + body));
    }
}
