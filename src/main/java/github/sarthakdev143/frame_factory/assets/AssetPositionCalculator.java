package github.sarthakdev143.frame_factory.assets;

import github.sarthakdev143.frame_factory.model.asset.AssetSpan;
import github.sarthakdev143.frame_factory.model.asset.RenderAsset;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconstructs continuous asset spans from the assets reported for each rendered frame.
 *
 * <p>An asset starts where it is absent from the previous frame and ends where it is absent
 * from the next one; the frames before the first and after the last count as empty. Entries
 * sharing an id within one frame collapse to the first one.
 */
@Component
public class AssetPositionCalculator {

    private final AssetSourceResolver sourceResolver;
    private final VolumeFlattener volumeFlattener;

    public AssetPositionCalculator(AssetSourceResolver sourceResolver, VolumeFlattener volumeFlattener) {
        this.sourceResolver = sourceResolver;
        this.volumeFlattener = volumeFlattener;
    }

    /**
     * @param frames assets per rendered frame, index 0 being the first rendered frame
     * @return spans in the order they started, with frame positions relative to the first rendered frame
     */
    public List<AssetSpan> calculate(List<List<RenderAsset>> frames) {
        List<OpenAssetSpan> spans = new ArrayList<>();
        Map<String, OpenAssetSpan> openById = new HashMap<>();

        Set<String> previous = Set.of();
        Collection<RenderAsset> current = frames.isEmpty() ? List.of() : deduplicate(frames, 0).values();

        for (int frame = 0; frame < frames.size(); frame++) {
            Map<String, RenderAsset> next = frame + 1 < frames.size() ? deduplicate(frames, frame + 1) : Map.of();

            for (RenderAsset asset : current) {
                if (!previous.contains(asset.id())) {
                    OpenAssetSpan opened = new OpenAssetSpan(
                            asset.id(),
                            asset.type(),
                            sourceResolver.resolve(frames, asset),
                            frame,
                            asset.mediaFrame(),
                            asset.playbackRate(),
                            asset.allowAmplificationDuringRender());
                    spans.add(opened);
                    if (openById.putIfAbsent(asset.id(), opened) != null) {
                        throw new AssetStitchingException(
                                "Asset " + asset.id() + " started at frame " + frame + " while still playing.");
                    }
                }

                OpenAssetSpan span = openById.get(asset.id());
                if (span == null) {
                    throw new AssetStitchingException("No open span for asset " + asset.id() + " at frame " + frame + ".");
                }

                span.addVolume(asset.volume());
                if (!next.containsKey(asset.id())) {
                    span.close(frame);
                    openById.remove(asset.id());
                }
            }

            previous = currentIds(current);
            current = next.values();
        }

        for (OpenAssetSpan span : spans) {
            if (span.isOpen()) {
                throw new AssetStitchingException(
                        "Duration of asset " + span.id() + " starting at frame " + span.startInVideo() + " is unexpectedly unknown.");
            }
        }

        List<AssetSpan> finalized = new ArrayList<>(spans.size());
        for (OpenAssetSpan span : spans) {
            finalized.add(volumeFlattener.flatten(span));
        }
        return finalized;
    }

    private Map<String, RenderAsset> deduplicate(List<List<RenderAsset>> frames, int index) {
        List<RenderAsset> assets = frames.get(index);
        if (assets == null) {
            throw new AssetStitchingException("No assets were recorded for rendered frame " + index + ".");
        }

        Map<String, RenderAsset> deduplicated = new LinkedHashMap<>();
        for (RenderAsset asset : assets) {
            deduplicated.putIfAbsent(asset.id(), asset);
        }
        return deduplicated;
    }

    private Set<String> currentIds(Collection<RenderAsset> assets) {
        Set<String> ids = new HashSet<>();
        for (RenderAsset asset : assets) {
            ids.add(asset.id());
        }
        return ids;
    }
}
