package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.ImageFormat;

import java.util.List;

/**
 * Ordered frames of one render together with the zero-pad width used for their file names.
 * Position {@code i} of {@link #frames()} owns slot {@code i} of the per-frame asset lists.
 */
public record FramePlan(
        List<Integer> frames,
        int padLength) {

    public FramePlan {
        frames = frames == null ? List.of() : List.copyOf(frames);
    }

    public int frameCount() {
        return frames.size();
    }

    public int frameAt(int index) {
        return frames.get(index);
    }

    public int lastFrame() {
        return frames.get(frames.size() - 1);
    }

    public String fileNameFor(int frame, ImageFormat format) {
        String padded = String.valueOf(frame);
        if (padded.length() < padLength) {
            padded = "0".repeat(padLength - padded.length()) + padded;
        }
        return "element-" + padded + "." + format.extension();
    }
}
