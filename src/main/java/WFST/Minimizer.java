package WFST;

import java.util.ArrayList;
import java.util.List;

import WFST.Encode.EncodeTable;
import WFST.Encode.EncodeType;
import WFST.Model.Arc;
import WFST.Model.Fst;
import WFST.Model.FstProperty;
import WFST.Model.MutableFst;
import WFST.Semiring.Semiring;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

/**
 * Minimization of deterministic automata. The unweighted core is AutomataLib's Hopcroft minimizer; weighted
 * acceptors are pushed and weight-encoded first, transducers are label-encoded first.
 */
public class Minimizer {
    private Minimizer() {}

    public static <W> void minimize(MutableFst<W> fst) {
        minimize(fst, Semiring.DELTA);
    }

    /**
     * Minimize in place. The automaton must be input-deterministic, otherwise it is only flagged with
     * {@link FstProperty#ERROR}.
     * @param fst - deterministic automaton
     * @param delta - quantization of pushed weights
     */
    public static <W> void minimize(MutableFst<W> fst, float delta) {
        if (fst.start() == Fst.NO_STATE) {
            return;
        }
        if (!fst.property(FstProperty.I_DETERMINISTIC, true).isTrue()) {
            if (Optimizer.DEBUG) {
                System.out.println("DEBUG: Minimize: input is not deterministic");
            }
            fst.setError();
            return;
        }

        if (!fst.property(FstProperty.ACCEPTOR, true).isTrue()) {
            EncodeTable<W> table = Encoder.encode(fst, EncodeType.LABELS);
            minimize(fst, delta);
            Encoder.decode(fst, table);
            return;
        }

        if (!fst.property(FstProperty.UNWEIGHTED, true).isTrue()) {
            FstTrim.connect(fst);
            Push.pushWeights(fst, ReweightType.TO_INITIAL, delta);
            quantize(fst, delta);
            EncodeTable<W> table = Encoder.encode(fst, EncodeType.LABELS_AND_WEIGHTS);
            acceptorMinimize(fst);
            Encoder.decode(fst, table);
            return;
        }

        acceptorMinimize(fst);
    }

    private static <W> void quantize(MutableFst<W> fst, float delta) {
        final Semiring<W> semiring = fst.semiring();
        for (int s = 0; s < fst.numStates(); s++) {
            List<Arc<W>> arcs = new ArrayList<>(fst.numArcs(s));
            for (Arc<W> arc : fst.arcs(s)) {
                arcs.add(arc.withWeight(semiring.quantize(arc.weight(), delta)));
            }
            fst.setArcs(s, arcs);
            if (fst.isFinal(s)) {
                fst.setFinal(s, semiring.quantize(fst.finalWeight(s), delta));
            }
        }
    }

    /**
     * Minimize a deterministic, unweighted acceptor.
     */
    static <W> void acceptorMinimize(MutableFst<W> fst) {
        FstTrim.connect(fst);
        if (fst.start() == Fst.NO_STATE || fst.numArcs() == 0) {
            return;
        }
        final Alphabet<Integer> alphabet = PowersetDeterminizer.labels(fst);
        final CompactDFA<Integer> dfa = toDFA(fst, alphabet);
        if (dfa == null) {
            fst.setError();
            return;
        }
        // the DFA has no sink state, so it is partial
        final CompactDFA<Integer> minimal = HopcroftMinimizer.minimizePartialDFA(dfa, alphabet);
        fromDFA(minimal, alphabet, fst);
        FstTrim.connect(fst);
        fst.setProperty(FstProperty.ACCEPTOR, true);
        fst.setProperty(FstProperty.I_DETERMINISTIC, true);
        fst.setProperty(FstProperty.O_DETERMINISTIC, true);
        fst.setProperty(FstProperty.UNWEIGHTED, true);
        fst.setProperty(FstProperty.UNWEIGHTED_CYCLES, true);
    }

    /**
     * @return the DFA, or null if two arcs of one state share a label
     */
    private static <W> CompactDFA<Integer> toDFA(Fst<W> fst, Alphabet<Integer> alphabet) {
        CompactDFA<Integer> dfa = new CompactDFA<>(alphabet, fst.numStates());
        for (int s = 0; s < fst.numStates(); s++) {
            dfa.addState(fst.isFinal(s));
        }
        dfa.setInitial(fst.start(), true);
        for (int s = 0; s < fst.numStates(); s++) {
            Integer source = s;
            for (Arc<W> arc : fst.arcs(s)) {
                // boxed on purpose: the int overloads take symbol indices, not symbols
                Integer symbol = arc.ilabel();
                Integer target = arc.nextState();
                if (dfa.getSuccessor(source, symbol) != null) {
                    if (Optimizer.DEBUG) {
                        System.out.println("DEBUG: Minimize: state " + s + " has two arcs labelled " + symbol);
                    }
                    return null;
                }
                dfa.addTransition(source, symbol, target);
            }
        }
        return dfa;
    }

    private static <W> void fromDFA(CompactDFA<Integer> dfa, Alphabet<Integer> alphabet, MutableFst<W> fst) {
        final W one = fst.semiring().one();
        fst.deleteAllStates();
        Integer init = dfa.getInitialState();
        if (init == null) {
            return;
        }
        for (Integer q : dfa.getStates()) {
            int s = fst.addState();
            if (dfa.isAccepting(q)) {
                fst.setFinal(s, one);
            }
        }
        fst.setStart(init);
        for (Integer q : dfa.getStates()) {
            for (Integer sym : alphabet) {
                Integer succ = dfa.getSuccessor(q, sym);
                if (succ != null) {
                    fst.addArc(q, new Arc<>(sym, sym, one, succ));
                }
            }
        }
    }
}
