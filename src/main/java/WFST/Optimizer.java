package WFST;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import WFST.Encode.EncodeTable;
import WFST.Encode.EncodeType;
import WFST.Model.FstProperty;
import WFST.Model.MutableFst;

/**
 * Rewrites an automaton in place into an equivalent, reduced form. The sequence of rewrites is chosen from the
 * automaton's known properties and the algebraic class of its semiring; there is no iteration.
 * <p>
 * With {@code computeProps == false} only cached properties are consulted and an unknown property counts as
 * false, which selects the more conservative branch. Failures of the underlying rewrites are not reported here:
 * they flag the automaton with {@link FstProperty#ERROR}, to be checked with {@code fst.hasError()}.
 */
public class Optimizer {
    public static boolean DEBUG = false;

    /** If any of these holds, weights do not have to be encoded before determinization. */
    private static final Set<FstProperty> DO_NOT_ENCODE_WEIGHTS = Collections.unmodifiableSet(EnumSet.of(
        FstProperty.ACYCLIC, FstProperty.UNWEIGHTED, FstProperty.UNWEIGHTED_CYCLES));

    private Optimizer() {}

    public static <W> void optimize(MutableFst<W> fst) {
        optimize(fst, false);
    }

    /**
     * @param fst - automaton, rewritten in place
     * @param computeProps - whether unknown properties may be computed
     */
    public static <W> void optimize(MutableFst<W> fst, boolean computeProps) {
        if (!fst.property(FstProperty.ACCEPTOR, computeProps).isTrue()) {
            debug("Optimize transducer");
            optimizeTransducer(fst, computeProps);
        } else {
            debug("Optimize acceptor");
            optimizeAcceptor(fst, computeProps);
        }
    }

    public static <W> void optimizeTransducer(MutableFst<W> fst, boolean computeProps) {
        maybeRmEpsilon(fst, computeProps);
        debug("ArcSum");
        ArcSum.arcSum(fst);

        if (!fst.semiring().isIdempotent()) {
            debug("Weights not idempotent");
            if (isInputDeterministic(fst, computeProps)) {
                debug("I_DETERMINISTIC -> minimize");
                Minimizer.minimize(fst);
            } else if (fst.property(FstProperty.ACYCLIC, computeProps).isTrue()) {
                // Acyclic automata over a zero-sum-free semiring have the twins property (Mohri 2006)
                debug("ACYCLIC -> encode labels, determinize, minimize, decode");
                encodeDeterminizeMinimizeDecode(fst, EncodeType.LABELS);
            } else {
                debug("Possibly cyclic, not known deterministic -> stop");
            }
            return;
        }

        debug("Weights idempotent");
        if (isInputDeterministic(fst, computeProps)) {
            debug("I_DETERMINISTIC -> minimize");
            Minimizer.minimize(fst);
        } else if (fst.knownProperties(DO_NOT_ENCODE_WEIGHTS, computeProps).isEmpty()) {
            debug("Weighted cycles possible -> encode labels and weights, determinize, minimize, decode, arcsum");
            encodeDeterminizeMinimizeDecode(fst, EncodeType.LABELS_AND_WEIGHTS);
            ArcSum.arcSum(fst);
        } else {
            debug("Encode labels -> encode, determinize, minimize, decode");
            encodeDeterminizeMinimizeDecode(fst, EncodeType.LABELS);
        }
    }

    /**
     * {@link #optimizeTransducer(MutableFst, boolean)} for automata known to be acceptors: labels need no
     * encoding.
     */
    public static <W> void optimizeAcceptor(MutableFst<W> fst, boolean computeProps) {
        maybeRmEpsilon(fst, computeProps);
        debug("ArcSum");
        ArcSum.arcSum(fst);

        if (!fst.semiring().isIdempotent()) {
            debug("Weights not idempotent");
            if (isInputDeterministic(fst, computeProps)) {
                debug("I_DETERMINISTIC -> minimize");
                Minimizer.minimize(fst);
            } else if (fst.property(FstProperty.ACYCLIC, computeProps).isTrue()) {
                debug("ACYCLIC -> determinize, minimize");
                determinizeAndMinimize(fst);
            } else {
                debug("Possibly cyclic, not known deterministic -> stop");
            }
            return;
        }

        debug("Weights idempotent");
        if (isInputDeterministic(fst, computeProps)) {
            debug("I_DETERMINISTIC -> minimize");
            Minimizer.minimize(fst);
        } else if (fst.knownProperties(DO_NOT_ENCODE_WEIGHTS, computeProps).isEmpty()) {
            debug("Weighted cycles possible -> encode weights, determinize, minimize, decode, arcsum");
            encodeDeterminizeMinimizeDecode(fst, EncodeType.WEIGHTS);
            ArcSum.arcSum(fst);
        } else {
            debug("determinize, minimize");
            determinizeAndMinimize(fst);
        }
    }

    /**
     * Push output labels towards the start state, then remove epsilons. Meant for unions of string pairs, where
     * this saves about as many states and arcs as the shorter string of each pair is long.
     */
    public static <W> void optimizeStringCrossProducts(MutableFst<W> fst) {
        optimizeStringCrossProducts(fst, false);
    }

    public static <W> void optimizeStringCrossProducts(MutableFst<W> fst, boolean computeProps) {
        debug("Push labels");
        MutableFst<W> snapshot = fst.copy();
        Push.pushLabels(snapshot, fst);
        maybeRmEpsilon(fst, computeProps);
    }

    /**
     * Make an unweighted acceptor usable as the right-hand side of a difference: epsilon-free, deterministic and
     * sorted by input label. The left-hand side needs no sorting once the right-hand side is deterministic.
     */
    public static <W> void prepareDifferenceRhs(MutableFst<W> fst) {
        prepareDifferenceRhs(fst, false);
    }

    public static <W> void prepareDifferenceRhs(MutableFst<W> fst, boolean computeProps) {
        maybeRmEpsilon(fst, computeProps);
        // determinizing an acceptor introduces no epsilons
        if (!isInputDeterministic(fst, computeProps)) {
            debug("Not I_DETERMINISTIC -> determinize");
            determinize(fst);
        }
        ArcSort.arcSort(fst, ArcSort.Type.ILABEL);
    }

    /**
     * Encode, determinize, minimize, decode. Weight-only encoding of an acceptor is done with labels as well, so
     * that the encoded automaton stays an acceptor; on acceptors the two encodings agree.
     */
    static <W> void encodeDeterminizeMinimizeDecode(MutableFst<W> fst, EncodeType type) {
        if (type == EncodeType.WEIGHTS && fst.property(FstProperty.ACCEPTOR, true).isTrue()) {
            type = EncodeType.LABELS_AND_WEIGHTS;
        }
        EncodeTable<W> table = Encoder.encode(fst, type);
        determinizeAndMinimize(fst);
        Encoder.decode(fst, table);
    }

    static <W> void determinizeAndMinimize(MutableFst<W> fst) {
        determinize(fst);
        Minimizer.minimize(fst);
    }

    /**
     * Determinize "in place": the construction reads a copy and writes into the automaton itself.
     */
    static <W> void determinize(MutableFst<W> fst) {
        MutableFst<W> snapshot = fst.copy();
        Determinizer.determinize(snapshot, fst);
    }

    private static <W> void maybeRmEpsilon(MutableFst<W> fst, boolean computeProps) {
        if (!fst.property(FstProperty.NO_EPSILONS, computeProps).isTrue()) {
            debug("RmEpsilon");
            RmEpsilon.rmEpsilon(fst);
        }
    }

    private static <W> boolean isInputDeterministic(MutableFst<W> fst, boolean computeProps) {
        return fst.property(FstProperty.I_DETERMINISTIC, computeProps).isTrue();
    }

    private static void debug(String message) {
        if (DEBUG) {
            System.out.println("DEBUG: " + message);
        }
    }
}
