package github.sarthakdev143.frame_factory.render.worker;

public class WorkerRequestException extends RuntimeException {

    public WorkerRequestException(String message) {
        super(message);
    }

    public WorkerRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
