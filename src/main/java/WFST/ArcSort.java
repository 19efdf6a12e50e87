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

/**
 * Stable per-state arc sorting, as needed by matchers in composition and difference.
 */
public class ArcSort {
    public enum Type {
        ILABEL(Comparator.<Arc<?>>comparingInt(Arc::ilabel).thenComparingInt(Arc::olabel),
            FstProperty.I_LABEL_SORTED),
        OLABEL(Comparator.<Arc<?>>comparingInt(Arc::olabel).thenComparingInt(Arc::ilabel),
            FstProperty.O_LABEL_SORTED);

        private final Comparator<Arc<?>> order;
        private final FstProperty sorted;

        Type(Comparator<Arc<?>> order, FstProperty sorted) {
            this.order = order;
            this.sorted = sorted;
        }

        public Comparator<Arc<?>> order() {
            return order;
        }
    }

    private ArcSort() {}

    public static <W> void arcSort(MutableFst<W> fst, Type type) {
        if (fst.property(type.sorted, false).isTrue()) {
            return;
        }
        Map<FstProperty, Boolean> before = fst.propertyCache().snapshot();
        for (int s = 0; s < fst.numStates(); s++) {
            List<Arc<W>> arcs = fst.arcs(s);
            if (arcs.size() < 2) {
                continue;
            }
            List<Arc<W>> sorted = new ArrayList<>(arcs);
            // List.sort is a stable merge sort
            sorted.sort(type.order);
            fst.setArcs(s, sorted);
        }
        // reordering arcs changes nothing but the other sort order
        Set<FstProperty> preserved = EnumSet.copyOf(FstProperty.COMPUTABLE);
        preserved.remove(FstProperty.I_LABEL_SORTED);
        preserved.remove(FstProperty.O_LABEL_SORTED);
        fst.propertyCache().restore(before, preserved);
        fst.setProperty(type.sorted, true);
    }
}
