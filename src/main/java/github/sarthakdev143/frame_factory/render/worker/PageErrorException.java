package github.sarthakdev143.frame_factory.render.worker;

/**
 * Error thrown inside the page rather than by a call made to it.
 */
public class PageErrorException extends RuntimeException {

    public PageErrorException(String message) {
        super(message);
    }
}
