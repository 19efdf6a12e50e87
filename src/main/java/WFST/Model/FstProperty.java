package WFST.Model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Structural facts about one automaton instance. All but {@link #ERROR} can be computed by a traversal, see
 * {@link PropertyComputer}.
 */
public enum FstProperty {
    /** ilabel == olabel for each arc. */
    ACCEPTOR,
    /** No arc has both labels epsilon. */
    NO_EPSILONS,
    /** ilabels unique leaving each state. */
    I_DETERMINISTIC,
    /** olabels unique leaving each state. */
    O_DETERMINISTIC,
    /** No cycles at all. */
    ACYCLIC,
    /** No cycle through the start state. */
    INITIAL_ACYCLIC,
    /** Only trivial arc and final weights. */
    UNWEIGHTED,
    /** Every arc on a cycle has weight one. */
    UNWEIGHTED_CYCLES,
    /** ilabels sorted for each state. */
    I_LABEL_SORTED,
    /** olabels sorted for each state. */
    O_LABEL_SORTED,
    /** All states reachable from the start state. */
    ACCESSIBLE,
    /** All states can reach a final state. */
    COACCESSIBLE,
    /** Some rewrite failed on this automaton. Sticky: survives mutations. */
    ERROR;

    /**
     * Everything a traversal can decide.
     */
    public static final Set<FstProperty> COMPUTABLE =
        Collections.unmodifiableSet(EnumSet.complementOf(EnumSet.of(ERROR)));

    /**
     * Facts that only depend on labels and topology, not on weights.
     */
    public static final Set<FstProperty> WEIGHT_INVARIANT = Collections.unmodifiableSet(EnumSet.of(
        ACCEPTOR, NO_EPSILONS, I_DETERMINISTIC, O_DETERMINISTIC, ACYCLIC, INITIAL_ACYCLIC,
        I_LABEL_SORTED, O_LABEL_SORTED, ACCESSIBLE, COACCESSIBLE));

    public boolean isComputable() {
        return this != ERROR;
    }
}
