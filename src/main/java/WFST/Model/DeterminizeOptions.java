package WFST.Model;

import WFST.Semiring.Semiring;

/**
 * Knobs of determinization.
 * @param delta - quantization applied to subset residuals before subsets are compared
 * @param stateThreshold - give up, flagging the result with {@link FstProperty#ERROR}, once the result has more
 *                       states than this
 */
public record DeterminizeOptions(float delta, int stateThreshold) {
    public static final DeterminizeOptions DEFAULT = new DeterminizeOptions(Semiring.DELTA, Integer.MAX_VALUE);

    public DeterminizeOptions {
        if (delta <= 0) {
            throw new IllegalArgumentException("delta must be positive: " + delta);
        }
        if (stateThreshold < 1) {
            throw new IllegalArgumentException("stateThreshold must be positive: " + stateThreshold);
        }
    }

    public boolean isAboveThreshold(int states) {
        return states > stateThreshold;
    }
}
