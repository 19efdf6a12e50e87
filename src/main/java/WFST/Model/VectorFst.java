package WFST.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import WFST.Semiring.Semiring;

/**
 * Array backed mutable automaton.
 * @param <W> - weight type
 */
public class VectorFst<W> implements MutableFst<W> {
    private final Semiring<W> semiring;
    private final List<W> finals;
    private final List<List<Arc<W>>> arcs;
    private final PropertyCache properties = new PropertyCache();
    private int start = NO_STATE;

    public VectorFst(Semiring<W> semiring) {
        this.semiring = Objects.requireNonNull(semiring);
        this.finals = new ArrayList<>();
        this.arcs = new ArrayList<>();
    }

    public VectorFst(Fst<W> other) {
        this(other.semiring());
        copyContents(other);
    }

    @Override
    public Semiring<W> semiring() {
        return semiring;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public int numStates() {
        return finals.size();
    }

    @Override
    public W finalWeight(int state) {
        checkState(state);
        return finals.get(state);
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        checkState(state);
        return Collections.unmodifiableList(arcs.get(state));
    }

    @Override
    public int numArcs(int state) {
        checkState(state);
        return arcs.get(state).size();
    }

    @Override
    public Ternary property(FstProperty property, boolean compute) {
        Ternary value = properties.get(property);
        if (value == Ternary.UNKNOWN && compute && property.isComputable()) {
            properties.setAll(PropertyComputer.compute(this));
            value = properties.get(property);
        }
        return value;
    }

    @Override
    public Set<FstProperty> knownProperties(Set<FstProperty> mask, boolean compute) {
        if (compute && !properties.isKnown(mask)) {
            properties.setAll(PropertyComputer.compute(this));
        }
        Set<FstProperty> result = EnumSet.noneOf(FstProperty.class);
        for (FstProperty p : mask) {
            if (properties.get(p).isTrue()) {
                result.add(p);
            }
        }
        return result;
    }

    @Override
    public int addState() {
        finals.add(semiring.zero());
        arcs.add(new ArrayList<>());
        properties.invalidate();
        return finals.size() - 1;
    }

    @Override
    public void setStart(int state) {
        if (state != NO_STATE) {
            checkState(state);
        }
        start = state;
        properties.invalidate();
    }

    @Override
    public void setFinal(int state, W weight) {
        checkState(state);
        finals.set(state, Objects.requireNonNull(weight));
        properties.invalidate();
    }

    @Override
    public void addArc(int state, Arc<W> arc) {
        checkState(state);
        checkState(arc.nextState());
        arcs.get(state).add(arc);
        properties.invalidate();
    }

    @Override
    public void setArcs(int state, List<Arc<W>> newArcs) {
        checkState(state);
        for (Arc<W> arc : newArcs) {
            checkState(arc.nextState());
        }
        arcs.set(state, new ArrayList<>(newArcs));
        properties.invalidate();
    }

    @Override
    public void deleteArcs(int state) {
        checkState(state);
        arcs.get(state).clear();
        properties.invalidate();
    }

    @Override
    public void deleteStates(BitSet dead) {
        if (dead.isEmpty()) {
            return;
        }
        final int n = numStates();
        int[] newId = new int[n];
        int next = 0;
        for (int s = 0; s < n; s++) {
            newId[s] = dead.get(s) ? NO_STATE : next++;
        }
        List<W> keptFinals = new ArrayList<>(next);
        List<List<Arc<W>>> keptArcs = new ArrayList<>(next);
        for (int s = 0; s < n; s++) {
            if (newId[s] == NO_STATE) {
                continue;
            }
            List<Arc<W>> renumbered = new ArrayList<>(arcs.get(s).size());
            for (Arc<W> arc : arcs.get(s)) {
                int target = newId[arc.nextState()];
                if (target != NO_STATE) {
                    renumbered.add(arc.withNextState(target));
                }
            }
            keptFinals.add(finals.get(s));
            keptArcs.add(renumbered);
        }
        finals.clear();
        finals.addAll(keptFinals);
        arcs.clear();
        arcs.addAll(keptArcs);
        start = start == NO_STATE ? NO_STATE : newId[start];
        properties.invalidate();
    }

    @Override
    public void deleteAllStates() {
        finals.clear();
        arcs.clear();
        start = NO_STATE;
        properties.invalidate();
    }

    @Override
    public void assign(Fst<W> other) {
        if (other == this) {
            return;
        }
        if (!semiring.equals(other.semiring())) {
            throw new IllegalArgumentException(
                "Cannot assign a " + other.semiring().name() + " automaton to a " + semiring.name() + " one");
        }
        finals.clear();
        arcs.clear();
        copyContents(other);
    }

    @Override
    public VectorFst<W> copy() {
        return new VectorFst<>(this);
    }

    @Override
    public PropertyCache propertyCache() {
        return properties;
    }

    private void copyContents(Fst<W> other) {
        for (int s = 0; s < other.numStates(); s++) {
            finals.add(other.finalWeight(s));
            arcs.add(new ArrayList<>(other.arcs(s)));
        }
        start = other.start();
        if (other instanceof MutableFst) {
            properties.copyFrom(((MutableFst<W>) other).propertyCache());
        } else {
            properties.invalidate();
        }
    }

    private void checkState(int state) {
        if (state < 0 || state >= finals.size()) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VectorFst)) {
            return false;
        }
        VectorFst<?> that = (VectorFst<?>) o;
        return start == that.start && semiring.equals(that.semiring)
            && finals.equals(that.finals) && arcs.equals(that.arcs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, finals, arcs);
    }

    /**
     * One line per arc, then one per final state, start state first.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int n = numStates();
        for (int i = 0; i < n; i++) {
            // start state goes first
            int s = i == 0 && start != NO_STATE ? start : (i <= start ? i - 1 : i);
            for (Arc<W> arc : arcs.get(s)) {
                sb.append(s).append('\t').append(arc.nextState()).append('\t')
                    .append(arc.ilabel()).append('\t').append(arc.olabel()).append('\t')
                    .append(arc.weight()).append('\n');
            }
        }
        for (int s = 0; s < n; s++) {
            if (isFinal(s)) {
                sb.append(s).append('\t').append(finals.get(s)).append('\n');
            }
        }
        return sb.toString();
    }
}
