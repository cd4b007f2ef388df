package github.sarthakdev143.frame_factory.model;

public enum RenderJobState {
    QUEUED,
    RENDERING,
    COMPLETED,
    FAILED
}
