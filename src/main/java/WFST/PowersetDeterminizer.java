package WFST;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

import WFST.Model.Arc;
import WFST.Model.DeterminizeOptions;
import WFST.Model.DeterminizeRecord;
import WFST.Model.Fst;
import WFST.Model.MutableFst;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.ts.AcceptorPowersetViewTS;

/**
 * Subset construction for unweighted acceptors, on top of AutomataLib's powerset view of a {@link CompactNFA}.
 */
public class PowersetDeterminizer {
    private static final int MISSING_ELEMENT = -1;

    private PowersetDeterminizer() {}

    /**
     * @param in - unweighted acceptor
     * @param out - empty automaton receiving the result
     * @param options - state threshold
     * @return false if the construction was stopped at the state threshold
     */
    static <W> boolean determinize(Fst<W> in, MutableFst<W> out, DeterminizeOptions options) {
        if (in.start() == Fst.NO_STATE) {
            return true;
        }
        final Alphabet<Integer> alphabet = labels(in);
        final CompactNFA<Integer> nfa = toNFA(in, alphabet);
        return doDeterminize(nfa.powersetView(), alphabet, in.semiring(), out, options);
    }

    static <W> Alphabet<Integer> labels(Fst<W> in) {
        IntSortedSet labels = new IntRBTreeSet();
        for (int s = 0; s < in.numStates(); s++) {
            for (Arc<W> arc : in.arcs(s)) {
                labels.add(arc.ilabel());
            }
        }
        List<Integer> sorted = new ArrayList<>(labels);
        return Alphabets.fromCollection(sorted);
    }

    static <W> CompactNFA<Integer> toNFA(Fst<W> in, Alphabet<Integer> alphabet) {
        CompactNFA<Integer> nfa = new CompactNFA<>(alphabet, in.numStates());
        for (int s = 0; s < in.numStates(); s++) {
            nfa.addState(in.isFinal(s));
        }
        nfa.setInitial(in.start(), true);
        for (int s = 0; s < in.numStates(); s++) {
            Integer source = s;
            for (Arc<W> arc : in.arcs(s)) {
                // boxed on purpose: the int overloads take symbol indices, not symbols
                Integer symbol = arc.ilabel();
                Integer target = arc.nextState();
                nfa.addTransition(source, symbol, target);
            }
        }
        return nfa;
    }

    private static <W> boolean doDeterminize(AcceptorPowersetViewTS<BitSet, Integer, ?> powerset,
                                             Collection<Integer> inputs,
                                             Semiring<W> semiring,
                                             MutableFst<W> out,
                                             DeterminizeOptions options) {
        final W one = semiring.one();
        Object2IntMap<BitSet> outStateMap = new Object2IntOpenHashMap<>();
        outStateMap.defaultReturnValue(MISSING_ELEMENT);
        Deque<DeterminizeRecord<BitSet>> stack = new ArrayDeque<>();

        BitSet init = powerset.getInitialState();
        int initOut = addState(out, powerset.isAccepting(init), one);
        out.setStart(initOut);
        outStateMap.put(init, initOut);
        stack.push(new DeterminizeRecord<>(init, initOut));

        while (!stack.isEmpty()) {
            if (options.isAboveThreshold(out.numStates())) {
                if (Optimizer.DEBUG) {
                    System.out.println("DEBUG: Powerset determinization stopped at " + out.numStates() + " states");
                }
                return false;
            }
            DeterminizeRecord<BitSet> curr = stack.pop();
            BitSet inState = curr.inputState();
            int outState = curr.outputAddress();

            for (Integer sym : inputs) {
                BitSet succ = powerset.getSuccessor(inState, sym);
                if (succ == null || succ.isEmpty()) {
                    continue;
                }
                int outSucc = outStateMap.getInt(succ);
                if (outSucc == MISSING_ELEMENT) {
                    // add new state to the result and to the stack
                    outSucc = addState(out, powerset.isAccepting(succ), one);
                    outStateMap.put(succ, outSucc);
                    stack.push(new DeterminizeRecord<>(succ, outSucc));
                }
                out.addArc(outState, new Arc<>(sym, sym, one, outSucc));
            }
        }
        return true;
    }

    private static <W> int addState(MutableFst<W> out, boolean accepting, W one) {
        int s = out.addState();
        if (accepting) {
            out.setFinal(s, one);
        }
        return s;
    }
}
