package WFST;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import WFST.Model.Arc;
import WFST.Model.DeterminizeOptions;
import WFST.Model.DeterminizeRecord;
import WFST.Model.Fst;
import WFST.Model.MutableFst;
import WFST.Semiring.DivideType;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Weighted subset construction (Mohri 1997). A subset is a list of (state, residual weight) pairs sorted by
 * state; residuals are quantized so that subsets that differ by rounding noise are merged.
 */
public class WeightedDeterminizer {
    private static final int MISSING_ELEMENT = -1;

    private WeightedDeterminizer() {}

    /**
     * One member of a subset.
     */
    record Element<W>(int state, W residual) {
    }

    /**
     * @param in - weighted acceptor
     * @param out - empty automaton receiving the result
     * @param options - delta and state threshold
     * @return false if the construction failed or was stopped at the state threshold
     */
    static <W> boolean determinize(Fst<W> in, MutableFst<W> out, DeterminizeOptions options) {
        if (in.start() == Fst.NO_STATE) {
            return true;
        }
        final Semiring<W> semiring = in.semiring();
        Object2IntMap<List<Element<W>>> registry = new Object2IntOpenHashMap<>();
        registry.defaultReturnValue(MISSING_ELEMENT);
        Deque<DeterminizeRecord<List<Element<W>>>> stack = new ArrayDeque<>();

        List<Element<W>> init = List.of(new Element<>(in.start(), semiring.one()));
        int initOut = out.addState();
        out.setStart(initOut);
        registry.put(init, initOut);
        stack.push(new DeterminizeRecord<>(init, initOut));

        while (!stack.isEmpty()) {
            if (options.isAboveThreshold(out.numStates())) {
                if (Optimizer.DEBUG) {
                    System.out.println("DEBUG: Weighted determinization stopped at " + out.numStates() + " states");
                }
                return false;
            }
            DeterminizeRecord<List<Element<W>>> curr = stack.pop();
            List<Element<W>> subset = curr.inputState();
            int outState = curr.outputAddress();

            W finalWeight = semiring.zero();
            // label -> (destination -> residual times arc weight), both in ascending order
            Int2ObjectSortedMap<Int2ObjectSortedMap<W>> byLabel = new Int2ObjectRBTreeMap<>();
            for (Element<W> element : subset) {
                finalWeight = semiring.plus(finalWeight,
                    semiring.times(element.residual(), in.finalWeight(element.state())));
                for (Arc<W> arc : in.arcs(element.state())) {
                    W w = semiring.times(element.residual(), arc.weight());
                    if (semiring.isZero(w)) {
                        continue;
                    }
                    Int2ObjectSortedMap<W> destinations = byLabel.get(arc.ilabel());
                    if (destinations == null) {
                        destinations = new Int2ObjectRBTreeMap<>();
                        destinations.defaultReturnValue(semiring.zero());
                        byLabel.put(arc.ilabel(), destinations);
                    }
                    destinations.put(arc.nextState(), semiring.plus(destinations.get(arc.nextState()), w));
                }
            }
            if (!semiring.isZero(finalWeight)) {
                out.setFinal(outState, finalWeight);
            }

            for (Int2ObjectMap.Entry<Int2ObjectSortedMap<W>> labelEntry : byLabel.int2ObjectEntrySet()) {
                int label = labelEntry.getIntKey();
                Int2ObjectSortedMap<W> destinations = labelEntry.getValue();
                W arcWeight = semiring.zero();
                for (W w : destinations.values()) {
                    arcWeight = semiring.plus(arcWeight, w);
                }
                if (semiring.isZero(arcWeight)) {
                    continue;
                }

                List<Element<W>> succ = new ArrayList<>(destinations.size());
                for (Int2ObjectMap.Entry<W> destination : destinations.int2ObjectEntrySet()) {
                    W residual = semiring.divide(destination.getValue(), arcWeight, DivideType.LEFT);
                    if (!semiring.isMember(residual)) {
                        if (Optimizer.DEBUG) {
                            System.out.println("DEBUG: Weighted determinization: cannot divide "
                                + destination.getValue() + " by " + arcWeight);
                        }
                        return false;
                    }
                    succ.add(new Element<>(destination.getIntKey(), semiring.quantize(residual, options.delta())));
                }

                int outSucc = registry.getInt(succ);
                if (outSucc == MISSING_ELEMENT) {
                    // add new state to the result and to the stack
                    outSucc = out.addState();
                    registry.put(succ, outSucc);
                    stack.push(new DeterminizeRecord<>(succ, outSucc));
                }
                out.addArc(outState, new Arc<>(label, label, arcWeight, outSucc));
            }
        }
        return true;
    }
}
