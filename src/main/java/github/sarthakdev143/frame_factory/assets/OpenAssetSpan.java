package github.sarthakdev143.frame_factory.assets;

import github.sarthakdev143.frame_factory.model.asset.AssetType;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Span under construction while stitching. The duration stays empty until the asset is seen
 * missing from the following frame and is set exactly once.
 */
final class OpenAssetSpan {

    private final String id;
    private final AssetType type;
    private final String src;
    private final int startInVideo;
    private final int trimLeft;
    private final double playbackRate;
    private final boolean allowAmplificationDuringRender;
    private final List<Double> volumes = new ArrayList<>();
    private OptionalInt duration = OptionalInt.empty();

    OpenAssetSpan(
            String id,
            AssetType type,
            String src,
            int startInVideo,
            int trimLeft,
            double playbackRate,
            boolean allowAmplificationDuringRender) {
        this.id = id;
        this.type = type;
        this.src = src;
        this.startInVideo = startInVideo;
        this.trimLeft = trimLeft;
        this.playbackRate = playbackRate;
        this.allowAmplificationDuringRender = allowAmplificationDuringRender;
    }

    void addVolume(double volume) {
        volumes.add(volume);
    }

    /**
     * Ends the span on {@code lastFrame}: a span opened on 0 and closed on 59 lasts 60 frames.
     */
    void close(int lastFrame) {
        if (duration.isPresent()) {
            throw new AssetStitchingException("Asset " + id + " starting at frame " + startInVideo + " was closed twice.");
        }
        duration = OptionalInt.of(lastFrame - startInVideo + 1);
    }

    boolean isOpen() {
        return duration.isEmpty();
    }

    String id() {
        return id;
    }

    AssetType type() {
        return type;
    }

    String src() {
        return src;
    }

    int startInVideo() {
        return startInVideo;
    }

    int trimLeft() {
        return trimLeft;
    }

    double playbackRate() {
        return playbackRate;
    }

    boolean allowAmplificationDuringRender() {
        return allowAmplificationDuringRender;
    }

    List<Double> volumes() {
        return volumes;
    }

    OptionalInt duration() {
        return duration;
    }
}
