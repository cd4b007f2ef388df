package github.sarthakdev143.frame_factory.model.asset;

/**
 * Continuous interval {@code [startInVideo, startInVideo + duration)} during which one media
 * asset plays in the rendered output.
 */
public record AssetSpan(
        String id,
        AssetType type,
        String src,
        int startInVideo,
        int duration,
        int trimLeft,
        double playbackRate,
        boolean allowAmplificationDuringRender,
        VolumeCurve volume) {
}
