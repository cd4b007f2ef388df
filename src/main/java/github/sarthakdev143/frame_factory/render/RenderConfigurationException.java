package github.sarthakdev143.frame_factory.render;

/**
 * Raised before any worker is opened when the render options are unusable.
 */
public class RenderConfigurationException extends IllegalArgumentException {

    public RenderConfigurationException(String message) {
        super(message);
    }
}
