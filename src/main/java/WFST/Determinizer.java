package WFST;

import WFST.Model.DeterminizeOptions;
import WFST.Model.Fst;
import WFST.Model.FstProperty;
import WFST.Model.MutableFst;

/**
 * Determinization of weighted acceptors. Transducers have to be encoded into acceptors first.
 */
public class Determinizer {
    private Determinizer() {}

    public static <W> void determinize(Fst<W> in, MutableFst<W> out) {
        determinize(in, out, DeterminizeOptions.DEFAULT);
    }

    /**
     * Determinize {@code in} into {@code out}, replacing whatever {@code out} held. The two must be different
     * objects: the construction reads {@code in} throughout.
     * <p>
     * Failures do not throw. A transducer input, a division without result, or a result above the options'
     * state threshold leave {@code out} flagged with {@link FstProperty#ERROR}.
     */
    public static <W> void determinize(Fst<W> in, MutableFst<W> out, DeterminizeOptions options) {
        if (in == out) {
            throw new IllegalArgumentException("Cannot determinize an automaton into itself; pass a copy");
        }
        out.deleteAllStates();
        if (in.hasError()) {
            out.setError();
        }
        if (!in.property(FstProperty.ACCEPTOR, true).isTrue()) {
            if (Optimizer.DEBUG) {
                System.out.println("DEBUG: Determinize: input is not an acceptor, encode its labels first");
            }
            out.setError();
            return;
        }

        // without idempotence, parallel paths of weight one still add up to something else
        final boolean unweighted = in.property(FstProperty.UNWEIGHTED, true).isTrue()
            && in.semiring().isIdempotent();
        final boolean completed;
        if (unweighted) {
            completed = PowersetDeterminizer.determinize(in, out, options);
        } else {
            completed = WeightedDeterminizer.determinize(in, out, options);
        }
        if (!completed) {
            out.setError();
            return;
        }

        out.setProperty(FstProperty.ACCEPTOR, true);
        out.setProperty(FstProperty.I_DETERMINISTIC, true);
        out.setProperty(FstProperty.O_DETERMINISTIC, true);
        out.setProperty(FstProperty.ACCESSIBLE, true);
        if (in.property(FstProperty.NO_EPSILONS, false).isTrue()) {
            out.setProperty(FstProperty.NO_EPSILONS, true);
        }
        if (unweighted) {
            out.setProperty(FstProperty.UNWEIGHTED, true);
            out.setProperty(FstProperty.UNWEIGHTED_CYCLES, true);
        }
        if (in.property(FstProperty.ACYCLIC, false).isTrue()) {
            out.setProperty(FstProperty.ACYCLIC, true);
        }
    }
}
