package github.sarthakdev143.frame_factory.render.worker;

import java.util.Map;

public record WorkerSession(
        String serveUrl,
        String compositionId,
        int width,
        int height,
        Object inputProps,
        Map<String, String> envVariables,
        int initialFrame) {

    public WorkerSession {
        if (envVariables == null) {
            envVariables = Map.of();
        } else {
            envVariables.forEach((key, value) -> {
                if (value == null) {
                    throw new IllegalArgumentException("envVariables value for " + key + " must not be null.");
                }
            });
            envVariables = Map.copyOf(envVariables);
        }
    }

    public String siteUrl() {
        String base = serveUrl.endsWith("/") ? serveUrl.substring(0, serveUrl.length() - 1) : serveUrl;
        return base + "/index.html?composition=" + compositionId;
    }
}
