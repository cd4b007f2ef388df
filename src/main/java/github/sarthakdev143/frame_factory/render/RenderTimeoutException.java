package github.sarthakdev143.frame_factory.render;

public class RenderTimeoutException extends RuntimeException {

    public static final String MESSAGE =
            "The rendering timed out. See https://www.remotion.dev/docs/timeout/ for possible reasons.";

    private final int frame;

    public RenderTimeoutException(int frame, Throwable cause) {
        super(MESSAGE, cause);
        this.frame = frame;
    }

    public int getFrame() {
        return frame;
    }
}
