package WFST.Model;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Computes every structural property of an automaton in one pass over the arcs plus one SCC decomposition.
 */
public final class PropertyComputer {

    private PropertyComputer() {}

    public static <W> Map<FstProperty, Boolean> compute(Fst<W> fst) {
        final Semiring<W> semiring = fst.semiring();
        final int n = fst.numStates();

        boolean acceptor = true;
        boolean noEpsilons = true;
        boolean iDeterministic = true;
        boolean oDeterministic = true;
        boolean iSorted = true;
        boolean oSorted = true;
        boolean unweighted = true;

        BitSet seenILabels = new BitSet();
        BitSet seenOLabels = new BitSet();
        for (int s = 0; s < n; s++) {
            seenILabels.clear();
            seenOLabels.clear();
            int prevI = Integer.MIN_VALUE;
            int prevO = Integer.MIN_VALUE;
            for (Arc<W> arc : fst.arcs(s)) {
                acceptor &= arc.ilabel() == arc.olabel();
                noEpsilons &= !arc.isEpsilon();
                iDeterministic &= !testAndSet(seenILabels, arc.ilabel());
                oDeterministic &= !testAndSet(seenOLabels, arc.olabel());
                iSorted &= arc.ilabel() >= prevI;
                oSorted &= arc.olabel() >= prevO;
                unweighted &= semiring.isOne(arc.weight());
                prevI = arc.ilabel();
                prevO = arc.olabel();
            }
            W f = fst.finalWeight(s);
            unweighted &= semiring.isOne(f) || semiring.isZero(f);
        }

        int[] component = stronglyConnectedComponents(fst);
        boolean acyclic = true;
        boolean unweightedCycles = true;
        boolean initialAcyclic = true;
        int[] componentSize = new int[n];
        for (int s = 0; s < n; s++) {
            componentSize[component[s]]++;
        }
        for (int s = 0; s < n; s++) {
            for (Arc<W> arc : fst.arcs(s)) {
                if (component[arc.nextState()] == component[s]) {
                    acyclic = false;
                    unweightedCycles &= semiring.isOne(arc.weight());
                    if (s == fst.start()) {
                        initialAcyclic = false;
                    }
                }
            }
        }
        if (fst.start() != Fst.NO_STATE && componentSize[component[fst.start()]] > 1) {
            initialAcyclic = false;
        }

        BitSet accessible = accessibleStates(fst);
        BitSet coaccessible = coaccessibleStates(fst);

        Map<FstProperty, Boolean> result = new EnumMap<>(FstProperty.class);
        result.put(FstProperty.ACCEPTOR, acceptor);
        result.put(FstProperty.NO_EPSILONS, noEpsilons);
        result.put(FstProperty.I_DETERMINISTIC, iDeterministic);
        result.put(FstProperty.O_DETERMINISTIC, oDeterministic);
        result.put(FstProperty.I_LABEL_SORTED, iSorted);
        result.put(FstProperty.O_LABEL_SORTED, oSorted);
        result.put(FstProperty.UNWEIGHTED, unweighted);
        result.put(FstProperty.ACYCLIC, acyclic);
        result.put(FstProperty.INITIAL_ACYCLIC, initialAcyclic);
        result.put(FstProperty.UNWEIGHTED_CYCLES, unweightedCycles);
        result.put(FstProperty.ACCESSIBLE, accessible.cardinality() == n);
        result.put(FstProperty.COACCESSIBLE, coaccessible.cardinality() == n);
        return result;
    }

    private static boolean testAndSet(BitSet seen, int label) {
        boolean present = seen.get(label);
        seen.set(label);
        return present;
    }

    /**
     * States reachable from the start state.
     */
    public static <W> BitSet accessibleStates(Fst<W> fst) {
        BitSet visited = new BitSet(fst.numStates());
        if (fst.start() == Fst.NO_STATE) {
            return visited;
        }
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(fst.start());
        visited.set(fst.start());
        while (!stack.isEmpty()) {
            int s = stack.pop();
            for (Arc<W> arc : fst.arcs(s)) {
                if (!visited.get(arc.nextState())) {
                    visited.set(arc.nextState());
                    stack.push(arc.nextState());
                }
            }
        }
        return visited;
    }

    /**
     * States from which some final state is reachable.
     */
    public static <W> BitSet coaccessibleStates(Fst<W> fst) {
        final int n = fst.numStates();
        List<IntArrayList> predecessors = predecessors(fst);
        BitSet visited = new BitSet(n);
        Deque<Integer> stack = new ArrayDeque<>();
        for (int s = 0; s < n; s++) {
            if (fst.isFinal(s)) {
                visited.set(s);
                stack.push(s);
            }
        }
        while (!stack.isEmpty()) {
            int s = stack.pop();
            for (int p : predecessors.get(s)) {
                if (!visited.get(p)) {
                    visited.set(p);
                    stack.push(p);
                }
            }
        }
        return visited;
    }

    /**
     * @return for each state, the source states of its incoming arcs (with repetition)
     */
    public static <W> List<IntArrayList> predecessors(Fst<W> fst) {
        final int n = fst.numStates();
        IntArrayList[] preds = new IntArrayList[n];
        for (int s = 0; s < n; s++) {
            preds[s] = new IntArrayList();
        }
        for (int s = 0; s < n; s++) {
            for (Arc<W> arc : fst.arcs(s)) {
                preds[arc.nextState()].add(s);
            }
        }
        return Arrays.asList(preds);
    }

    /**
     * Iterative Tarjan over all states, so that cycles in inaccessible parts count too.
     * @return component index of each state
     */
    public static <W> int[] stronglyConnectedComponents(Fst<W> fst) {
        final int n = fst.numStates();
        int[] index = new int[n];
        int[] lowLink = new int[n];
        int[] component = new int[n];
        int[] arcPos = new int[n];
        Arrays.fill(index, -1);
        BitSet onStack = new BitSet(n);
        IntArrayList sccStack = new IntArrayList();
        IntArrayList callStack = new IntArrayList();
        int nextIndex = 0;
        int nextComponent = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != -1) {
                continue;
            }
            callStack.add(root);
            index[root] = lowLink[root] = nextIndex++;
            sccStack.add(root);
            onStack.set(root);
            while (!callStack.isEmpty()) {
                int s = callStack.getInt(callStack.size() - 1);
                List<Arc<W>> out = fst.arcs(s);
                if (arcPos[s] < out.size()) {
                    int t = out.get(arcPos[s]++).nextState();
                    if (index[t] == -1) {
                        index[t] = lowLink[t] = nextIndex++;
                        sccStack.add(t);
                        onStack.set(t);
                        callStack.add(t);
                    } else if (onStack.get(t)) {
                        lowLink[s] = Math.min(lowLink[s], index[t]);
                    }
                    continue;
                }
                callStack.removeInt(callStack.size() - 1);
                if (!callStack.isEmpty()) {
                    int parent = callStack.getInt(callStack.size() - 1);
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[s]);
                }
                if (lowLink[s] == index[s]) {
                    int member;
                    do {
                        member = sccStack.removeInt(sccStack.size() - 1);
                        onStack.clear(member);
                        component[member] = nextComponent;
                    } while (member != s);
                    nextComponent++;
                }
            }
        }
        return component;
    }
}
