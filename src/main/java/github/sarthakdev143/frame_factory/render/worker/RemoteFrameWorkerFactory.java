package github.sarthakdev143.frame_factory.render.worker;

import github.sarthakdev143.frame_factory.config.RendererProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

@Component
public class RemoteFrameWorkerFactory implements FrameWorkerFactory {

    private static final Logger logger = LoggerFactory.getLogger(RemoteFrameWorkerFactory.class);
    private static final int DEVICE_SCALE_FACTOR = 1;

    private final WebClient client;
    private final Duration seekTimeout;
    private final Duration requestTimeout;

    public RemoteFrameWorkerFactory(@Qualifier("frameWorkerWebClient") WebClient client, RendererProperties properties) {
        this.client = client;
        this.seekTimeout = properties.getSeekTimeout();
        this.requestTimeout = properties.getRequestTimeout();
    }

    @Override
    public CompletableFuture<FrameWorker> open(WorkerSession session, Consumer<Throwable> errorListener) {
        WorkerMessages.CreateSessionRequest request = new WorkerMessages.CreateSessionRequest(
                session.siteUrl(),
                session.width(),
                session.height(),
                DEVICE_SCALE_FACTOR,
                session.inputProps(),
                session.envVariables(),
                session.initialFrame());

        return client.post()
                .uri("/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> RemoteFrameWorker.failure(response, "(new)", "open " + session.siteUrl()))
                .bodyToMono(WorkerMessages.SessionResponse.class)
                .timeout(requestTimeout)
                .onErrorMap(TimeoutException.class, e -> new WorkerRequestException(
                        "Opening " + session.siteUrl() + " timeout of " + requestTimeout.toMillis() + " ms exceeded",
                        e))
                .switchIfEmpty(Mono.error(
                        () -> new WorkerRequestException("Worker sidecar returned no session for " + session.siteUrl())))
                .<FrameWorker>map(response -> {
                    if (response.sessionId() == null || response.sessionId().isBlank()) {
                        throw new WorkerRequestException("Worker sidecar returned no session for " + session.siteUrl());
                    }
                    if (response.pageErrors() != null && errorListener != null) {
                        response.pageErrors().forEach(message -> errorListener.accept(new PageErrorException(message)));
                    }
                    logger.debug("Opened worker session {} for {}", response.sessionId(), session.siteUrl());
                    return new RemoteFrameWorker(client, response.sessionId(), seekTimeout, requestTimeout);
                })
                .toFuture();
    }
}
