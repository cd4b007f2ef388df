package github.sarthakdev143.frame_factory.service;

import github.sarthakdev143.frame_factory.dto.RenderJobRequest;
import github.sarthakdev143.frame_factory.model.RenderJobStatus;

import java.util.Optional;

public interface RenderJobService {

    /**
     * Validates the request and queues it for rendering.
     *
     * @return id of the queued job
     * @throws IllegalArgumentException if the request cannot be rendered
     */
    String submitRender(RenderJobRequest request);

    Optional<RenderJobStatus> getJobStatus(String jobId);
}
