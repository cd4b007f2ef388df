package github.sarthakdev143.frame_factory.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code POST /api/render}.
 *
 * @param frameRange a frame number, a {@code [start, end]} pair, or absent for every frame
 * @param outputDir  directory below the configured output root, defaults to the job id
 */
public record RenderJobRequest(
        String compositionId,
        String serveUrl,
        Integer width,
        Integer height,
        Double fps,
        Integer durationInFrames,
        JsonNode frameRange,
        String imageFormat,
        Integer quality,
        Integer concurrency,
        String outputDir,
        JsonNode inputProps,
        Map<String, String> envVariables) {

    public RenderJobRequest {
        // Null values are kept so the controller can reject them with a readable message.
        envVariables = envVariables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(envVariables));
    }
}
