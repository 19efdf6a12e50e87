package WFST;

/**
 * Direction in which {@link Push#pushWeights} moves weight.
 */
public enum ReweightType {
    /** Towards the start state, using distances to the final states. */
    TO_INITIAL,
    /** Towards the final states, using distances from the start state. */
    TO_FINAL
}
