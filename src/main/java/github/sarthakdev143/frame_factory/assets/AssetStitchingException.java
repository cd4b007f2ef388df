package github.sarthakdev143.frame_factory.assets;

/**
 * The per-frame asset lists could not be stitched into spans. Always a defect upstream, never
 * a user error.
 */
public class AssetStitchingException extends IllegalStateException {

    public AssetStitchingException(String message) {
        super(message);
    }
}
