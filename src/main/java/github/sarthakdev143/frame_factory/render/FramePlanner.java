package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.FrameRange;

import java.util.ArrayList;
import java.util.List;

public final class FramePlanner {

    private FramePlanner() {
    }

    /**
     * Resolves the frames to render for a composition.
     *
     * @param durationInFrames duration of the composition, must be positive
     * @param frameRange       requested range, or {@code null} for the whole composition
     * @return strictly increasing frames within {@code [0, durationInFrames - 1]}
     * @throws RenderConfigurationException if the range falls outside the composition
     */
    public static FramePlan plan(int durationInFrames, FrameRange frameRange) {
        if (durationInFrames <= 0) {
            throw new RenderConfigurationException(
                    "durationInFrames must be positive, but got " + durationInFrames + ".");
        }
        validateFrameRange(durationInFrames, frameRange);

        int first = frameRange == null ? 0 : frameRange.start();
        int last = frameRange == null ? durationInFrames - 1 : frameRange.end();

        List<Integer> frames = new ArrayList<>(last - first + 1);
        for (int frame = first; frame <= last; frame++) {
            frames.add(frame);
        }

        // 100 frames are named 00-99, so the width comes from the last frame rather than the count.
        return new FramePlan(frames, String.valueOf(last).length());
    }

    public static int initialFrame(FrameRange frameRange) {
        return frameRange == null ? 0 : frameRange.start();
    }

    static void validateFrameRange(int durationInFrames, FrameRange frameRange) {
        if (frameRange == null) {
            return;
        }

        if (frameRange.singleFrame()) {
            int frame = frameRange.start();
            if (frame < 0) {
                throw new RenderConfigurationException("Frame " + frame + " cannot be negative.");
            }
            if (frame > durationInFrames - 1) {
                throw new RenderConfigurationException(
                        "Frame number is out of range, must be between 0 and "
                                + (durationInFrames - 1) + " but got " + frame + ".");
            }
            return;
        }

        int start = frameRange.start();
        int end = frameRange.end();
        if (start < 0) {
            throw new RenderConfigurationException(
                    "The start frame of a frame range must be at least 0, but got " + start + ".");
        }
        if (end < start) {
            throw new RenderConfigurationException(
                    "The end frame of a frame range must not be before its start frame, but got ["
                            + start + ", " + end + "].");
        }
        if (end > durationInFrames - 1) {
            throw new RenderConfigurationException(
                    "Frame range [" + start + ", " + end + "] is not in between 0-" + (durationInFrames - 1) + ".");
        }
    }
}
