package WFST;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;

import WFST.Model.Arc;
import WFST.Model.Fst;
import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Generic single-source shortest distance (Mohri 2002): queue driven relaxation that stops once no distance
 * changes by more than delta.
 */
public class ShortestDistance {
    private ShortestDistance() {}

    /**
     * Distances from one state, following only the arcs accepted by the filter.
     * @return distance of every reached state; unreached states are absent (semiring zero)
     */
    public static <W> Int2ObjectMap<W> singleSource(Fst<W> fst, int source, Predicate<Arc<W>> filter, float delta) {
        final Semiring<W> semiring = fst.semiring();
        final W zero = semiring.zero();
        Int2ObjectMap<W> distance = new Int2ObjectOpenHashMap<>();
        Int2ObjectMap<W> residual = new Int2ObjectOpenHashMap<>();
        distance.defaultReturnValue(zero);
        residual.defaultReturnValue(zero);

        distance.put(source, semiring.one());
        residual.put(source, semiring.one());
        Deque<Integer> queue = new ArrayDeque<>();
        BitSet enqueued = new BitSet();
        queue.add(source);
        enqueued.set(source);

        while (!queue.isEmpty()) {
            int q = queue.poll();
            enqueued.clear(q);
            W r = residual.get(q);
            residual.put(q, zero);
            for (Arc<W> arc : fst.arcs(q)) {
                if (!filter.test(arc)) {
                    continue;
                }
                int next = arc.nextState();
                W w = semiring.times(r, arc.weight());
                W old = distance.get(next);
                W updated = semiring.plus(old, w);
                if (!semiring.approxEqual(old, updated, delta)) {
                    distance.put(next, updated);
                    residual.put(next, semiring.plus(residual.get(next), w));
                    if (!enqueued.get(next)) {
                        enqueued.set(next);
                        queue.add(next);
                    }
                }
            }
        }
        return distance;
    }

    /**
     * Distances from the start state to every state.
     */
    public static <W> List<W> forward(Fst<W> fst, float delta) {
        final int n = fst.numStates();
        List<W> result = new ArrayList<>(n);
        if (fst.start() == Fst.NO_STATE) {
            for (int s = 0; s < n; s++) {
                result.add(fst.semiring().zero());
            }
            return result;
        }
        Int2ObjectMap<W> distance = singleSource(fst, fst.start(), arc -> true, delta);
        for (int s = 0; s < n; s++) {
            result.add(distance.get(s));
        }
        return result;
    }

    /**
     * Distance from every state to the final states, in the fst's own semiring.
     */
    public static <W> List<W> reverse(Fst<W> fst, float delta) {
        return reverse(fst, fst.semiring(), Arc::weight, fst::finalWeight, delta);
    }

    /**
     * Distance from every state to the final states, with arc values taken from an arbitrary semiring. Arc
     * values are multiplied on the left, so left semirings such as the string semiring are handled.
     * @param fst - automaton
     * @param semiring - semiring of the values
     * @param arcValue - value of an arc
     * @param finalValue - value of a state's final weight (zero if not final)
     * @param delta - convergence tolerance
     */
    public static <W, V> List<V> reverse(Fst<W> fst, Semiring<V> semiring, Function<Arc<W>, V> arcValue,
                                         IntFunction<V> finalValue, float delta) {
        final int n = fst.numStates();
        final V zero = semiring.zero();
        List<List<Arc<W>>> incoming = new ArrayList<>(n);
        for (int s = 0; s < n; s++) {
            incoming.add(new ArrayList<>());
        }
        for (int s = 0; s < n; s++) {
            for (Arc<W> arc : fst.arcs(s)) {
                // reversed: points back to the source
                incoming.get(arc.nextState()).add(arc.withNextState(s));
            }
        }

        List<V> distance = new ArrayList<>(n);
        List<V> residual = new ArrayList<>(n);
        Deque<Integer> queue = new ArrayDeque<>();
        BitSet enqueued = new BitSet(n);
        for (int s = 0; s < n; s++) {
            V f = finalValue.apply(s);
            distance.add(f);
            residual.add(f);
            if (!semiring.isZero(f)) {
                queue.add(s);
                enqueued.set(s);
            }
        }

        while (!queue.isEmpty()) {
            int q = queue.poll();
            enqueued.clear(q);
            V r = residual.get(q);
            residual.set(q, zero);
            for (Arc<W> reversed : incoming.get(q)) {
                int p = reversed.nextState();
                V v = semiring.times(arcValue.apply(reversed), r);
                V old = distance.get(p);
                V updated = semiring.plus(old, v);
                if (!semiring.approxEqual(old, updated, delta)) {
                    distance.set(p, updated);
                    residual.set(p, semiring.plus(residual.get(p), v));
                    if (!enqueued.get(p)) {
                        enqueued.set(p);
                        queue.add(p);
                    }
                }
            }
        }
        return distance;
    }
}
