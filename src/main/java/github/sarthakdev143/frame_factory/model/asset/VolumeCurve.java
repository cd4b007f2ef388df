package github.sarthakdev143.frame_factory.model.asset;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Flattened volume of an asset span. Either a single constant volume or one point per
 * output frame of the span.
 */
public record VolumeCurve(
        Double constantVolume,
        List<VolumePoint> points) {

    public VolumeCurve {
        points = points == null ? List.of() : List.copyOf(points);
        if (constantVolume == null && points.isEmpty()) {
            throw new IllegalArgumentException("Volume curve must have a constant volume or at least one point.");
        }
    }

    public static VolumeCurve constant(double volume) {
        return new VolumeCurve(volume, List.of());
    }

    public static VolumeCurve of(List<VolumePoint> points) {
        return new VolumeCurve(null, points);
    }

    @JsonIgnore
    public boolean isConstant() {
        return constantVolume != null;
    }

    public double volumeAt(int frameOffset) {
        if (isConstant()) {
            return constantVolume;
        }
        int index = Math.max(0, Math.min(frameOffset, points.size() - 1));
        return points.get(index).volume();
    }
}
