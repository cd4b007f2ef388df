package github.sarthakdev143.frame_factory.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ConcurrencyResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyResolver.class);
    private static final int MAX_DEFAULT_CONCURRENCY = 8;

    private final int availableProcessors;

    public ConcurrencyResolver() {
        this(Runtime.getRuntime().availableProcessors());
    }

    ConcurrencyResolver(int availableProcessors) {
        this.availableProcessors = Math.max(1, availableProcessors);
    }

    /**
     * Number of workers to open. Unspecified means half the processors, capped at 8. An
     * explicit value is clamped to {@code [1, availableProcessors]}.
     */
    public int resolve(Integer requested) {
        if (requested == null) {
            return defaultConcurrency();
        }

        int clamped = Math.max(1, Math.min(requested, availableProcessors));
        if (clamped != requested) {
            logger.warn(
                    "Requested concurrency {} is outside 1-{}, using {} workers instead",
                    requested,
                    availableProcessors,
                    clamped);
        }
        return clamped;
    }

    int defaultConcurrency() {
        return (int) Math.round(Math.min(MAX_DEFAULT_CONCURRENCY, Math.max(1, availableProcessors / 2.0)));
    }
}
