package WFST.Model;

import java.util.List;
import java.util.Set;

import WFST.Semiring.Semiring;

/**
 * Read access to a weighted automaton with dense integer states.
 * @param <W> - weight type
 */
public interface Fst<W> {
    int NO_STATE = -1;

    Semiring<W> semiring();

    /**
     * @return start state, or {@link #NO_STATE} for the empty automaton
     */
    int start();

    int numStates();

    /**
     * @return final weight, semiring zero if the state is not final
     */
    W finalWeight(int state);

    List<Arc<W>> arcs(int state);

    default int numArcs(int state) {
        return arcs(state).size();
    }

    default int numArcs() {
        int n = 0;
        for (int s = 0; s < numStates(); s++) {
            n += numArcs(s);
        }
        return n;
    }

    default boolean isFinal(int state) {
        return !semiring().isZero(finalWeight(state));
    }

    /**
     * Look up a property.
     * @param property - the property
     * @param compute - whether an unknown value may be computed now
     * @return the value, {@link Ternary#UNKNOWN} if not cached and not computed
     */
    Ternary property(FstProperty property, boolean compute);

    /**
     * @param mask - properties of interest
     * @param compute - whether unknown values may be computed now
     * @return the members of the mask known to be true
     */
    Set<FstProperty> knownProperties(Set<FstProperty> mask, boolean compute);

    default boolean hasError() {
        return property(FstProperty.ERROR, false).isTrue();
    }
}
