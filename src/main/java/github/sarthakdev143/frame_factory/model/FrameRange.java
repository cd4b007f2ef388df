package github.sarthakdev143.frame_factory.model;

/**
 * Inclusive range of frames requested for rendering. A single frame is a range whose start
 * and end are equal. The full composition is expressed by the absence of a range.
 */
public record FrameRange(
        int start,
        int end,
        boolean singleFrame) {

    public FrameRange {
        if (singleFrame && start != end) {
            throw new IllegalArgumentException(
                    "A single-frame range must start and end on the same frame, but got [" + start + ", " + end + "].");
        }
    }

    public static FrameRange single(int frame) {
        return new FrameRange(frame, frame, true);
    }

    public static FrameRange between(int start, int end) {
        return new FrameRange(start, end, false);
    }

    public int frameCount() {
        return end - start + 1;
    }
}
