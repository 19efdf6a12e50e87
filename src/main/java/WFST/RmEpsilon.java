package WFST;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import WFST.Model.Arc;
import WFST.Model.FstProperty;
import WFST.Model.MutableFst;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;

/**
 * Epsilon removal: replaces every path of epsilon arcs followed by a labelled arc with one arc carrying the
 * total weight of the epsilon closure.
 */
public class RmEpsilon {
    private RmEpsilon() {}

    public static <W> void rmEpsilon(MutableFst<W> fst) {
        rmEpsilon(fst, Semiring.DELTA);
    }

    public static <W> void rmEpsilon(MutableFst<W> fst, float delta) {
        final Semiring<W> semiring = fst.semiring();
        final int n = fst.numStates();
        Map<FstProperty, Boolean> before = fst.propertyCache().snapshot();

        // Closures read other states' arcs, so compute everything before writing anything back.
        List<List<Arc<W>>> newArcs = new ArrayList<>(n);
        List<W> newFinals = new ArrayList<>(n);
        boolean changed = false;
        for (int p = 0; p < n; p++) {
            if (!hasEpsilon(fst.arcs(p))) {
                newArcs.add(null);
                newFinals.add(null);
                continue;
            }
            changed = true;
            Int2ObjectMap<W> closure = ShortestDistance.singleSource(fst, p, Arc::isEpsilon, delta);
            int[] reached = closure.keySet().toIntArray();
            Arrays.sort(reached);

            List<Arc<W>> arcs = new ArrayList<>();
            W finalWeight = semiring.zero();
            for (int q : reached) {
                W d = closure.get(q);
                for (Arc<W> arc : fst.arcs(q)) {
                    if (!arc.isEpsilon()) {
                        arcs.add(arc.withWeight(semiring.times(d, arc.weight())));
                    }
                }
                finalWeight = semiring.plus(finalWeight, semiring.times(d, fst.finalWeight(q)));
            }
            newArcs.add(arcs);
            newFinals.add(finalWeight);
        }

        if (changed) {
            for (int p = 0; p < n; p++) {
                if (newArcs.get(p) != null) {
                    fst.setArcs(p, newArcs.get(p));
                    fst.setFinal(p, newFinals.get(p));
                }
            }
            FstTrim.connect(fst);
            fst.propertyCache().restoreTrue(before, EnumSet.of(FstProperty.ACCEPTOR));
        }
        fst.setProperty(FstProperty.NO_EPSILONS, true);
    }

    private static <W> boolean hasEpsilon(List<Arc<W>> arcs) {
        for (Arc<W> arc : arcs) {
            if (arc.isEpsilon()) {
                return true;
            }
        }
        return false;
    }
}
