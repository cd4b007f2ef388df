package github.sarthakdev143.frame_factory.render.worker;

import github.sarthakdev143.frame_factory.model.ImageFormat;
import github.sarthakdev143.frame_factory.model.asset.RenderAsset;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Handle to one page that hosts the composition. Every call is a request to the page and
 * completes asynchronously; a worker serves one render task at a time.
 */
public interface FrameWorker {

    String id();

    /**
     * Moves the page to {@code frame} and completes once the frame is ready to capture.
     */
    CompletableFuture<Void> seekToFrame(int frame);

    /**
     * Captures the current frame into {@code output}.
     *
     * @param quality JPEG quality, {@code null} to use the page default
     */
    CompletableFuture<Void> captureFrame(ImageFormat format, Integer quality, Path output);

    /**
     * Media elements mounted on the page for the current frame.
     */
    CompletableFuture<List<RenderAsset>> collectAssets();

    /**
     * Registers a listener for errors raised by the page outside of a direct call.
     */
    void addErrorListener(Consumer<Throwable> listener);

    void removeErrorListener(Consumer<Throwable> listener);

    CompletableFuture<Void> close();
}
