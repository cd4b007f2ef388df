package github.sarthakdev143.frame_factory.assets;

import github.sarthakdev143.frame_factory.model.asset.RenderAsset;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the {@code src} a page reported into the location the encoder reads from.
 *
 * <p>Pages send a long source only the first time and afterwards refer to it as
 * {@code same-as-<id>-<frame>}, naming the asset and frame that carried the full value.
 */
@Component
public class AssetSourceResolver {

    private static final Pattern COMPRESSED_SRC_PATTERN = Pattern.compile("^same-as-(.*)-([0-9]+)$");
    private static final Pattern SCHEME_PATTERN = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]+:");

    public String resolve(List<List<RenderAsset>> frames, RenderAsset asset) {
        return resolveAssetSrc(uncompress(frames, asset));
    }

    String uncompress(List<List<RenderAsset>> frames, RenderAsset asset) {
        String src = asset.src();
        if (src == null) {
            throw new AssetStitchingException("Asset " + asset.id() + " has no src.");
        }

        Matcher matcher = COMPRESSED_SRC_PATTERN.matcher(src);
        if (!matcher.matches()) {
            return src;
        }

        String id = matcher.group(1);
        int frame = Integer.parseInt(matcher.group(2));
        for (List<RenderAsset> frameAssets : frames) {
            if (frameAssets == null) {
                continue;
            }
            for (RenderAsset candidate : frameAssets) {
                if (candidate.id().equals(id)
                        && candidate.frame() == frame
                        && candidate.src() != null
                        && !COMPRESSED_SRC_PATTERN.matcher(candidate.src()).matches()) {
                    return candidate.src();
                }
            }
        }

        throw new AssetStitchingException(
                "Cannot uncompress src of asset " + asset.id() + ": no asset " + id + " was reported at frame " + frame + ".");
    }

    String resolveAssetSrc(String src) {
        if (src.startsWith("file:")) {
            return Path.of(URI.create(src)).toAbsolutePath().toString();
        }
        if (SCHEME_PATTERN.matcher(src).find()) {
            return src;
        }
        return Path.of(src).toAbsolutePath().toString();
    }
}
