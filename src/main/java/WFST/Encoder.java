package WFST;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import WFST.Encode.EncodeTable;
import WFST.Encode.EncodeTuple;
import WFST.Encode.EncodeType;
import WFST.Model.Arc;
import WFST.Model.Fst;
import WFST.Model.FstProperty;
import WFST.Model.MutableFst;
import WFST.Semiring.Semiring;

/**
 * Reversible relabelling that folds label pairs and/or weights into single labels, so that acceptor algorithms
 * can be applied to transducers and unweighted algorithms to weighted automata.
 */
public class Encoder {
    private static final Set<FstProperty> LABEL_ENCODING_PRESERVED = EnumSet.of(
        FstProperty.INITIAL_ACYCLIC, FstProperty.ACCESSIBLE, FstProperty.COACCESSIBLE,
        FstProperty.UNWEIGHTED, FstProperty.UNWEIGHTED_CYCLES);

    private Encoder() {}

    /**
     * Encode in place.
     * @param fst - automaton to encode
     * @param type - what to fold into the labels
     * @return the table needed by {@link #decode(MutableFst, EncodeTable)}
     */
    public static <W> EncodeTable<W> encode(MutableFst<W> fst, EncodeType type) {
        final Semiring<W> semiring = fst.semiring();
        final EncodeTable<W> table = new EncodeTable<>(type, semiring);
        final int n = fst.numStates();
        Map<FstProperty, Boolean> before = fst.propertyCache().snapshot();

        for (int s = 0; s < n; s++) {
            List<Arc<W>> encoded = new ArrayList<>(fst.numArcs(s));
            for (Arc<W> arc : fst.arcs(s)) {
                int code = table.encode(arc.ilabel(), arc.olabel(), arc.weight());
                encoded.add(new Arc<>(code,
                    type.encodeLabels() ? code : arc.olabel(),
                    type.encodeWeights() ? semiring.one() : arc.weight(),
                    arc.nextState()));
            }
            fst.setArcs(s, encoded);
        }

        if (type.encodeWeights()) {
            // Final weights must be encoded as well: move them onto arcs into one super-final state.
            int superFinal = Fst.NO_STATE;
            for (int s = 0; s < n; s++) {
                W finalWeight = fst.finalWeight(s);
                if (semiring.isZero(finalWeight)) {
                    continue;
                }
                if (superFinal == Fst.NO_STATE) {
                    superFinal = fst.addState();
                    fst.setFinal(superFinal, semiring.one());
                }
                int code = table.encode(Arc.EPSILON, Arc.EPSILON, finalWeight);
                fst.addArc(s, new Arc<>(code, type.encodeLabels() ? code : Arc.EPSILON, semiring.one(), superFinal));
                fst.setFinal(s, semiring.zero());
            }
        }

        fst.propertyCache().restore(before, EnumSet.of(FstProperty.ACYCLIC));
        if (!type.encodeWeights()) {
            fst.propertyCache().restore(before, LABEL_ENCODING_PRESERVED);
            // distinct input labels get distinct codes
            fst.propertyCache().restoreTrue(before, EnumSet.of(FstProperty.I_DETERMINISTIC));
        }
        fst.setProperty(FstProperty.NO_EPSILONS, true);
        if (type.encodeLabels()) {
            fst.setProperty(FstProperty.ACCEPTOR, true);
        }
        if (type.encodeWeights()) {
            fst.setProperty(FstProperty.UNWEIGHTED, true);
            fst.setProperty(FstProperty.UNWEIGHTED_CYCLES, true);
        }
        return table;
    }

    /**
     * Undo {@link #encode(MutableFst, EncodeType)}. Epsilon arcs added after encoding (e.g. by weight pushing)
     * pass through unchanged. Other labels the table does not know flag the automaton with
     * {@link FstProperty#ERROR} and are left as they are.
     */
    public static <W> void decode(MutableFst<W> fst, EncodeTable<W> table) {
        final Semiring<W> semiring = fst.semiring();
        final EncodeType type = table.type();

        for (int s = 0; s < fst.numStates(); s++) {
            List<Arc<W>> decoded = new ArrayList<>(fst.numArcs(s));
            for (Arc<W> arc : fst.arcs(s)) {
                if (arc.ilabel() == Arc.EPSILON && (!type.encodeLabels() || arc.olabel() == Arc.EPSILON)) {
                    decoded.add(arc);
                    continue;
                }
                EncodeTuple<W> tuple = table.decode(arc.ilabel());
                if (tuple == null || (type.encodeLabels() && arc.ilabel() != arc.olabel())) {
                    if (Optimizer.DEBUG) {
                        System.out.println("DEBUG: Decode: no tuple for arc " + arc + " of state " + s);
                    }
                    fst.setError();
                    decoded.add(arc);
                    continue;
                }
                decoded.add(new Arc<>(tuple.ilabel(),
                    type.encodeLabels() ? tuple.olabel() : arc.olabel(),
                    type.encodeWeights() ? semiring.times(arc.weight(), tuple.weight()) : arc.weight(),
                    arc.nextState()));
            }
            fst.setArcs(s, decoded);
        }
        rmFinalEpsilon(fst);
    }

    /**
     * Fold epsilon arcs into final states without outgoing arcs back into final weights, then connect. Removes
     * the super-final state introduced by weight encoding.
     */
    public static <W> void rmFinalEpsilon(MutableFst<W> fst) {
        final Semiring<W> semiring = fst.semiring();
        final int n = fst.numStates();
        BitSet sinks = new BitSet(n);
        for (int s = 0; s < n; s++) {
            if (fst.isFinal(s) && fst.numArcs(s) == 0) {
                sinks.set(s);
            }
        }
        if (sinks.isEmpty()) {
            return;
        }

        boolean changed = false;
        for (int s = 0; s < n; s++) {
            List<Arc<W>> kept = new ArrayList<>(fst.numArcs(s));
            W finalWeight = fst.finalWeight(s);
            for (Arc<W> arc : fst.arcs(s)) {
                if (arc.isEpsilon() && sinks.get(arc.nextState())) {
                    finalWeight = semiring.plus(finalWeight,
                        semiring.times(arc.weight(), fst.finalWeight(arc.nextState())));
                } else {
                    kept.add(arc);
                }
            }
            if (kept.size() != fst.numArcs(s)) {
                fst.setArcs(s, kept);
                fst.setFinal(s, finalWeight);
                changed = true;
            }
        }
        if (changed) {
            FstTrim.connect(fst);
        }
    }
}
