package github.sarthakdev143.frame_factory.model.asset;

/**
 * One media element the page reported as mounted while a frame was on screen.
 *
 * @param id                             stable identity of the element across frames
 * @param frame                          composition frame the element was reported at
 * @param mediaFrame                     frame of the source media shown at this instant
 * @param volume                         volume of the element at this instant
 * @param allowAmplificationDuringRender whether volume above 1 is kept
 */
public record RenderAsset(
        String id,
        int frame,
        AssetType type,
        String src,
        int mediaFrame,
        double playbackRate,
        double volume,
        boolean allowAmplificationDuringRender) {
}
