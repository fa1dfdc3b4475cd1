package domain.convert;

/**
 * Caller-owned holder of the most recent {@link PipelineResult}, for debugging or display.
 *
 * <p>{@link NlSqlPipeline} never reads it. Not thread-safe: keep one per caller.</p>
 */
public final class PipelineResultCache {

    private PipelineResult last;

    /** Stores {@code result} as the latest and returns it unchanged. */
    public PipelineResult remember(PipelineResult result) {
        this.last = result;
        return result;
    }

    /** @return the latest remembered result, or null */
    public PipelineResult last() {
        return last;
    }

    public void clear() {
        this.last = null;
    }
}
