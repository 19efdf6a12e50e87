package WFST;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import WFST.Model.Arc;
import WFST.Model.FstProperty;
import WFST.Model.MutableFst;
import WFST.Semiring.Semiring;

/**
 * Combines arcs that share source, destination and both labels into one arc whose weight is the sum.
 */
public class ArcSum {
    private static final Comparator<Arc<?>> SUM_ORDER = Comparator.<Arc<?>>comparingInt(Arc::ilabel)
        .thenComparingInt(Arc::olabel)
        .thenComparingInt(Arc::nextState);

    /** Merging parallel arcs never changes which labels leave a state, nor the topology. */
    private static final Set<FstProperty> PRESERVED = EnumSet.of(
        FstProperty.ACCEPTOR, FstProperty.NO_EPSILONS, FstProperty.ACYCLIC, FstProperty.INITIAL_ACYCLIC,
        FstProperty.ACCESSIBLE, FstProperty.COACCESSIBLE);

    /** Can only go from false to true, when duplicates were all that broke them. */
    private static final Set<FstProperty> PRESERVED_IF_TRUE = EnumSet.of(
        FstProperty.I_DETERMINISTIC, FstProperty.O_DETERMINISTIC);

    private ArcSum() {}

    public static <W> void arcSum(MutableFst<W> fst) {
        final Semiring<W> semiring = fst.semiring();
        Map<FstProperty, Boolean> before = fst.propertyCache().snapshot();
        boolean changed = false;

        for (int s = 0; s < fst.numStates(); s++) {
            List<Arc<W>> arcs = fst.arcs(s);
            if (arcs.size() < 2) {
                continue;
            }
            List<Arc<W>> sorted = new ArrayList<>(arcs);
            sorted.sort(SUM_ORDER);
            List<Arc<W>> summed = new ArrayList<>(sorted.size());
            Arc<W> current = sorted.get(0);
            for (int i = 1; i < sorted.size(); i++) {
                Arc<W> arc = sorted.get(i);
                if (SUM_ORDER.compare(current, arc) == 0) {
                    current = current.withWeight(semiring.plus(current.weight(), arc.weight()));
                } else {
                    summed.add(current);
                    current = arc;
                }
            }
            summed.add(current);
            if (!summed.equals(arcs)) {
                fst.setArcs(s, summed);
                changed = true;
            }
        }

        if (changed) {
            fst.propertyCache().restore(before, PRESERVED);
            fst.propertyCache().restoreTrue(before, PRESERVED_IF_TRUE);
        }
    }
}
