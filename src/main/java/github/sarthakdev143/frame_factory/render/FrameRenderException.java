package github.sarthakdev143.frame_factory.render;

public class FrameRenderException extends RuntimeException {

    private final int frame;

    public FrameRenderException(int frame, Throwable cause) {
        super("Rendering frame " + frame + " failed: " + describe(cause), cause);
        this.frame = frame;
    }

    public int getFrame() {
        return frame;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
