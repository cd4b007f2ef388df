package github.sarthakdev143.frame_factory.assets;

import github.sarthakdev143.frame_factory.model.asset.AssetSpan;
import github.sarthakdev143.frame_factory.model.asset.VolumeCurve;
import github.sarthakdev143.frame_factory.model.asset.VolumePoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class VolumeFlattener {

    static final double MAX_VOLUME = 1.0;
    static final double MAX_AMPLIFIED_VOLUME = 20.0;

    /**
     * Finalizes a closed span, collapsing its per-frame samples into one {@link VolumeCurve}.
     * Samples are clamped to 1 unless amplification is allowed; a span whose samples are all
     * equal gets a constant curve.
     */
    AssetSpan flatten(OpenAssetSpan span) {
        if (span.isOpen()) {
            throw new AssetStitchingException("Asset " + span.id() + " starting at frame " + span.startInVideo() + " was never closed.");
        }
        if (!(span.playbackRate() > 0)) {
            throw new AssetStitchingException(
                    "Asset " + span.id() + " has an invalid playback rate " + span.playbackRate() + ".");
        }
        if (span.volumes().isEmpty()) {
            throw new AssetStitchingException("Asset " + span.id() + " has no volume samples.");
        }

        double ceiling = span.allowAmplificationDuringRender() ? MAX_AMPLIFIED_VOLUME : MAX_VOLUME;
        List<Double> samples = span.volumes();
        List<VolumePoint> points = new ArrayList<>(samples.size());
        boolean constant = true;
        double first = clamp(samples.get(0), ceiling);

        for (int offset = 0; offset < samples.size(); offset++) {
            double volume = clamp(samples.get(offset), ceiling);
            if (Double.compare(volume, first) != 0) {
                constant = false;
            }
            points.add(new VolumePoint(offset, span.trimLeft() + offset * span.playbackRate(), volume));
        }

        return new AssetSpan(
                span.id(),
                span.type(),
                span.src(),
                span.startInVideo(),
                span.duration().getAsInt(),
                span.trimLeft(),
                span.playbackRate(),
                span.allowAmplificationDuringRender(),
                constant ? VolumeCurve.constant(first) : VolumeCurve.of(points));
    }

    private double clamp(Double sample, double ceiling) {
        if (sample == null || !Double.isFinite(sample) || sample < 0) {
            return 0.0;
        }
        return Math.min(sample, ceiling);
    }
}
