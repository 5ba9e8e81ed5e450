package io.hivememory.learning;

/**
 * How the Q-learning step size evolves for a state-action pair.
 */
public enum RateSchedule {

    /** Fixed alpha from configuration. */
    CONSTANT,

    /**
     * alpha = 1 / n for the n-th update of a pair: the value becomes the mean of the
     * TD targets, independent of the order the experiences arrive in.
     */
    SAMPLE_AVERAGE;

    public double alpha(double configuredRate, long updateNumber) {
        return switch (this) {
            case CONSTANT -> configuredRate;
            case SAMPLE_AVERAGE -> 1.0 / Math.max(1, updateNumber);
        };
    }
}
