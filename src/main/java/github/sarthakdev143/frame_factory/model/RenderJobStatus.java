package github.sarthakdev143.frame_factory.model;

import github.sarthakdev143.frame_factory.model.asset.AssetSpan;

import java.time.Instant;
import java.util.List;

public record RenderJobStatus(
        String jobId,
        RenderJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        String compositionId,
        Integer frameCount,
        int framesRendered,
        String lastFramePath,
        List<AssetSpan> assets,
        String errorMessage) {

    public RenderJobStatus {
        assets = assets == null ? List.of() : List.copyOf(assets);
    }
}
