package github.sarthakdev143.frame_factory.render.worker;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

public interface FrameWorkerFactory {

    /**
     * Opens a page for the session's composition, positioned at the session's initial frame.
     *
     * @param errorListener receives page errors raised while the page loads
     */
    CompletableFuture<FrameWorker> open(WorkerSession session, Consumer<Throwable> errorListener);
}
