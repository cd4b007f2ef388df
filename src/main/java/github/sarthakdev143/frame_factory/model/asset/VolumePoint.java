package github.sarthakdev143.frame_factory.model.asset;

/**
 * Volume of an asset span at one output frame.
 *
 * @param frameOffset offset in output frames from the start of the span
 * @param mediaTime   position in the source media, in source frames
 */
public record VolumePoint(
        int frameOffset,
        double mediaTime,
        double volume) {
}
