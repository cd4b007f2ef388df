package github.sarthakdev143.frame_factory.dto;

import github.sarthakdev143.frame_factory.model.RenderJobState;

public record RenderJobSubmissionResponse(
        String jobId,
        RenderJobState state,
        String message) {
}
