package github.sarthakdev143.frame_factory.render.worker;

import github.sarthakdev143.frame_factory.model.asset.RenderAsset;

import java.util.List;
import java.util.Map;

/**
 * JSON bodies exchanged with the page automation sidecar.
 */
final class WorkerMessages {

    private WorkerMessages() {
    }

    record CreateSessionRequest(
            String url,
            int width,
            int height,
            int deviceScaleFactor,
            Object inputProps,
            Map<String, String> envVariables,
            int initialFrame) {
    }

    record SessionResponse(
            String sessionId,
            List<String> pageErrors) {
    }

    record SeekRequest(int frame) {
    }

    record ScreenshotRequest(
            String format,
            Integer quality) {
    }

    record PageResponse(List<String> pageErrors) {
    }

    record AssetsResponse(
            List<RenderAsset> assets,
            List<String> pageErrors) {
    }
}
