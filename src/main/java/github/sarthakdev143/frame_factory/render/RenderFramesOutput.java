package github.sarthakdev143.frame_factory.render;

import github.sarthakdev143.frame_factory.model.asset.RenderAsset;

import java.util.List;

/**
 * @param frameAssets raw assets per planned frame, in plan order
 */
public record RenderFramesOutput(
        int frameCount,
        List<List<RenderAsset>> frameAssets) {

    public RenderFramesOutput {
        frameAssets = frameAssets == null ? List.of() : List.copyOf(frameAssets);
    }
}
