package github.sarthakdev143.frame_factory.controller;

import github.sarthakdev143.frame_factory.dto.RenderJobRequest;
import github.sarthakdev143.frame_factory.dto.RenderJobSubmissionResponse;
import github.sarthakdev143.frame_factory.model.RenderJobState;
import github.sarthakdev143.frame_factory.service.RenderJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/api/render")
public class RenderController {

    private static final Logger logger = LoggerFactory.getLogger(RenderController.class);
    private static final int MAX_COMPOSITION_ID_LENGTH = 200;
    private static final int MAX_ENV_VARIABLES = 100;
    private static final Pattern COMPOSITION_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-\\u4E00-\\u9FFF]+$");

    private final RenderJobService renderJobService;

    public RenderController(RenderJobService renderJobService) {
        this.renderJobService = renderJobService;
    }

    @PostMapping(consumes = "application/json")
    public ResponseEntity<?> submitRender(@RequestBody RenderJobRequest request) {
        try {
            validateRequest(request);
            String jobId = renderJobService.submitRender(request);
            return ResponseEntity.accepted()
                    .body(new RenderJobSubmissionResponse(
                            jobId,
                            RenderJobState.QUEUED,
                            "Render job accepted. Poll /api/render/status/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Submitting render job failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to queue the render job. Please try again.");
        }
    }

    @GetMapping("/status/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return renderJobService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    private void validateRequest(RenderJobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("A render request body is required.");
        }

        String compositionId = request.compositionId();
        if (compositionId == null || compositionId.isBlank()) {
            throw new IllegalArgumentException("compositionId is required.");
        }
        if (compositionId.length() > MAX_COMPOSITION_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "compositionId must be at most " + MAX_COMPOSITION_ID_LENGTH + " characters.");
        }
        if (!COMPOSITION_ID_PATTERN.matcher(compositionId).matches()) {
            throw new IllegalArgumentException("compositionId can only contain a-z, A-Z, 0-9, CJK characters and -.");
        }

        if (request.serveUrl() == null || request.serveUrl().isBlank()) {
            throw new IllegalArgumentException("serveUrl is required.");
        }

        Map<String, String> envVariables = request.envVariables();
        if (envVariables.size() > MAX_ENV_VARIABLES) {
            throw new IllegalArgumentException("At most " + MAX_ENV_VARIABLES + " envVariables are allowed.");
        }
        for (Map.Entry<String, String> entry : envVariables.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("envVariables keys must not be blank.");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("envVariables value for " + entry.getKey() + " must not be null.");
            }
        }
    }
}
