package github.sarthakdev143.frame_factory.render;

import java.nio.file.Path;

public interface RenderCallbacks {

    default void onStart(int frameCount) {
    }

    /**
     * Invoked once per finished frame, possibly from several threads, in completion order.
     */
    default void onFrameUpdate(int framesRendered, Path output, int frame) {
    }

    /**
     * @param frame the frame being rendered, {@code null} when no frame was assigned yet
     */
    default void onError(Throwable error, Integer frame) {
    }

    static RenderCallbacks none() {
        return new RenderCallbacks() {
        };
    }
}
