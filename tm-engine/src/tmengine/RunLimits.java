package tmengine;

/** Resource limits of one run. Both bounds are enforced before a level is expanded further. */
public record RunLimits(int maxDepth, int maxTransitions) {

    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final int DEFAULT_MAX_TRANSITIONS = 1000;

    public RunLimits {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        if (maxTransitions < 0) throw new IllegalArgumentException("maxTransitions must be >= 0, got " + maxTransitions);
    }

    public static RunLimits defaults() {
        return new RunLimits(DEFAULT_MAX_DEPTH, DEFAULT_MAX_TRANSITIONS);
    }

    /** Null fields fall back to the defaults. */
    public static RunLimits of(Integer maxDepth, Integer maxTransitions) {
        return new RunLimits(
                maxDepth == null ? DEFAULT_MAX_DEPTH : maxDepth,
                maxTransitions == null ? DEFAULT_MAX_TRANSITIONS : maxTransitions);
    }
}
