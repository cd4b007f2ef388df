package github.sarthakdev143.frame_factory.model;

public record CompositionConfig(
        int width,
        int height,
        double fps,
        int durationInFrames) {
}
