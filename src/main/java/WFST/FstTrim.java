package WFST;

import java.util.BitSet;
import java.util.Map;

import WFST.Model.FstProperty;
import WFST.Model.MutableFst;
import WFST.Model.PropertyComputer;

public class FstTrim {
    private FstTrim() {}

    /**
     * Remove every state that is not both accessible and coaccessible ("connect"). An automaton without a start
     * state loses all of its states.
     * @param fst - automaton, trimmed in place
     * @return number of states removed
     */
    public static <W> int connect(MutableFst<W> fst) {
        final int n = fst.numStates();
        BitSet keep = PropertyComputer.accessibleStates(fst);
        keep.and(PropertyComputer.coaccessibleStates(fst));

        int removed = n - keep.cardinality();
        if (removed > 0) {
            Map<FstProperty, Boolean> before = fst.propertyCache().snapshot();
            BitSet dead = new BitSet(n);
            dead.set(0, n);
            dead.andNot(keep);
            fst.deleteStates(dead);
            // deleting states and arcs cannot break any of these
            fst.propertyCache().restoreTrue(before, FstProperty.COMPUTABLE);
        }
        fst.setProperty(FstProperty.ACCESSIBLE, true);
        fst.setProperty(FstProperty.COACCESSIBLE, true);
        return removed;
    }
}
