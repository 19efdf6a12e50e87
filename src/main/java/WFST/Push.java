package WFST;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import WFST.Model.Arc;
import WFST.Model.Fst;
import WFST.Model.FstProperty;
import WFST.Model.MutableFst;
import WFST.Semiring.DivideType;
import WFST.Semiring.LeftStringSemiring;
import WFST.Semiring.Semiring;
import WFST.Semiring.StringWeight;

/**
 * Weight and label pushing. Both redistribute what a path carries along the path without changing the total,
 * so the weighted relation is unchanged.
 */
public class Push {
    /** Reweighting keeps labels and topology as long as no start state is added. */
    private static final Set<FstProperty> REWEIGHT_PRESERVED = EnumSet.of(
        FstProperty.ACCEPTOR, FstProperty.NO_EPSILONS, FstProperty.I_DETERMINISTIC, FstProperty.O_DETERMINISTIC,
        FstProperty.ACYCLIC, FstProperty.INITIAL_ACYCLIC, FstProperty.I_LABEL_SORTED, FstProperty.O_LABEL_SORTED,
        FstProperty.ACCESSIBLE, FstProperty.COACCESSIBLE);

    private static final Set<FstProperty> NEW_START_PRESERVED = EnumSet.of(
        FstProperty.ACCEPTOR, FstProperty.ACYCLIC, FstProperty.ACCESSIBLE, FstProperty.COACCESSIBLE);

    private Push() {}

    public static <W> void pushWeights(MutableFst<W> fst, ReweightType type) {
        pushWeights(fst, type, Semiring.DELTA);
    }

    /**
     * Push weights towards the start state or towards the final states.
     */
    public static <W> void pushWeights(MutableFst<W> fst, ReweightType type, float delta) {
        if (fst.start() == Fst.NO_STATE) {
            return;
        }
        List<W> potentials = type == ReweightType.TO_INITIAL
            ? ShortestDistance.reverse(fst, delta)
            : ShortestDistance.forward(fst, delta);
        reweight(fst, potentials, type);
    }

    /**
     * Reweight with the given potentials: for an arc from p to q, {@code d(p)^-1 w d(q)} when pushing to the
     * initial state, {@code d(p) w d(q)^-1} when pushing to the final states. States with potential zero keep
     * their weights. When pushing to the initial state, the potential of the start state is put in front of
     * every path: multiplied into the start state's arcs and final weight if no cycle passes through it, else
     * carried by an epsilon arc from a new start state.
     */
    public static <W> void reweight(MutableFst<W> fst, List<W> potentials, ReweightType type) {
        if (fst.start() == Fst.NO_STATE) {
            return;
        }
        if (potentials.size() != fst.numStates()) {
            throw new IllegalArgumentException(
                "Expected " + fst.numStates() + " potentials, got " + potentials.size());
        }
        final Semiring<W> semiring = fst.semiring();
        Map<FstProperty, Boolean> before = fst.propertyCache().snapshot();
        boolean failed = false;

        for (int p = 0; p < fst.numStates(); p++) {
            W dp = potentials.get(p);
            if (semiring.isZero(dp)) {
                continue;
            }
            List<Arc<W>> reweighted = new ArrayList<>(fst.numArcs(p));
            for (Arc<W> arc : fst.arcs(p)) {
                W dq = potentials.get(arc.nextState());
                W w = arc.weight();
                if (!semiring.isZero(dq)) {
                    w = type == ReweightType.TO_INITIAL
                        ? semiring.divide(semiring.times(w, dq), dp, DivideType.LEFT)
                        : semiring.divide(semiring.times(dp, w), dq, DivideType.RIGHT);
                }
                failed |= !semiring.isMember(w);
                reweighted.add(arc.withWeight(w));
            }
            fst.setArcs(p, reweighted);
            W finalWeight = fst.finalWeight(p);
            if (!semiring.isZero(finalWeight)) {
                finalWeight = type == ReweightType.TO_INITIAL
                    ? semiring.divide(finalWeight, dp, DivideType.LEFT)
                    : semiring.times(dp, finalWeight);
                failed |= !semiring.isMember(finalWeight);
                fst.setFinal(p, finalWeight);
            }
        }

        boolean newStart = false;
        W startPotential = potentials.get(fst.start());
        if (type == ReweightType.TO_INITIAL && !semiring.isOne(startPotential) && !semiring.isZero(startPotential)) {
            int start = fst.start();
            if (fst.property(FstProperty.INITIAL_ACYCLIC, true).isTrue()) {
                List<Arc<W>> arcs = new ArrayList<>(fst.numArcs(start));
                for (Arc<W> arc : fst.arcs(start)) {
                    arcs.add(arc.withWeight(semiring.times(startPotential, arc.weight())));
                }
                fst.setArcs(start, arcs);
                if (fst.isFinal(start)) {
                    fst.setFinal(start, semiring.times(startPotential, fst.finalWeight(start)));
                }
            } else {
                int s = fst.addState();
                fst.addArc(s, new Arc<>(Arc.EPSILON, Arc.EPSILON, startPotential, start));
                fst.setStart(s);
                newStart = true;
            }
        }

        if (newStart) {
            fst.propertyCache().restore(before, NEW_START_PRESERVED);
            fst.setProperty(FstProperty.INITIAL_ACYCLIC, true);
            fst.setProperty(FstProperty.NO_EPSILONS, false);
        } else {
            fst.propertyCache().restore(before, REWEIGHT_PRESERVED);
        }
        if (failed) {
            if (Optimizer.DEBUG) {
                System.out.println("DEBUG: Reweight: division without result in " + semiring.name());
            }
            fst.setError();
        }
    }

    /**
     * Push output labels towards the start state. Every output string is moved as early as the automaton allows,
     * and outputs longer than one label are spread over chains of new states, one label per arc. The result is
     * connected.
     * @param in - transducer to read
     * @param out - receives the result, replacing its contents; must not be {@code in}
     */
    public static <W> void pushLabels(Fst<W> in, MutableFst<W> out) {
        if (in == out) {
            throw new IllegalArgumentException("Cannot push labels of an automaton into itself; pass a copy");
        }
        out.assign(in);
        FstTrim.connect(out);
        if (out.start() == Fst.NO_STATE) {
            return;
        }
        final Semiring<W> semiring = out.semiring();
        final LeftStringSemiring strings = LeftStringSemiring.INSTANCE;
        final MutableFst<W> fst = out;
        List<StringWeight> residuals = ShortestDistance.reverse(fst, strings,
            arc -> StringWeight.ofLabel(arc.olabel()),
            s -> fst.isFinal(s) ? StringWeight.EMPTY : StringWeight.INFINITY,
            Semiring.DELTA);

        final int n = fst.numStates();
        List<List<Arc<W>>> pushedArcs = new ArrayList<>(n);
        List<List<StringWeight>> pushedOutputs = new ArrayList<>(n);
        for (int p = 0; p < n; p++) {
            StringWeight dp = residuals.get(p);
            List<Arc<W>> arcs = new ArrayList<>(fst.numArcs(p));
            List<StringWeight> outputs = new ArrayList<>(fst.numArcs(p));
            for (Arc<W> arc : fst.arcs(p)) {
                StringWeight path = strings.times(StringWeight.ofLabel(arc.olabel()), residuals.get(arc.nextState()));
                StringWeight output = strings.divide(path, dp, DivideType.LEFT);
                if (!strings.isMember(output)) {
                    fail(out, "Push labels: " + dp + " is not a prefix of " + path);
                    return;
                }
                arcs.add(arc);
                outputs.add(output);
            }
            pushedArcs.add(arcs);
            pushedOutputs.add(outputs);
        }

        for (int p = 0; p < n; p++) {
            List<Arc<W>> arcs = pushedArcs.get(p);
            List<StringWeight> outputs = pushedOutputs.get(p);
            List<Arc<W>> rewritten = new ArrayList<>(arcs.size());
            for (int i = 0; i < arcs.size(); i++) {
                rewritten.add(chain(fst, arcs.get(i), outputs.get(i), semiring));
            }
            fst.setArcs(p, rewritten);
        }

        // a final start state has an empty residual
        StringWeight startOutput = residuals.get(fst.start());
        if (startOutput.length() > 0) {
            int start = fst.start();
            if (fst.property(FstProperty.INITIAL_ACYCLIC, true).isTrue()) {
                List<Arc<W>> prefixed = new ArrayList<>(fst.numArcs(start));
                for (Arc<W> arc : fst.arcs(start)) {
                    StringWeight output = strings.times(startOutput, StringWeight.ofLabel(arc.olabel()));
                    prefixed.add(chain(fst, arc, output, semiring));
                }
                fst.setArcs(start, prefixed);
            } else {
                int s = fst.addState();
                fst.addArc(s, chain(fst, new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), start),
                    startOutput, semiring));
                fst.setStart(s);
            }
        }
        fst.setProperty(FstProperty.ACCESSIBLE, true);
        fst.setProperty(FstProperty.COACCESSIBLE, true);
    }

    /**
     * Give an arc the output string {@code output}. At most one label stays on the arc itself; further labels go
     * on epsilon-input arcs of weight one through new intermediate states.
     * @return the arc to put in place of {@code arc}
     */
    private static <W> Arc<W> chain(MutableFst<W> fst, Arc<W> arc, StringWeight output, Semiring<W> semiring) {
        if (output.length() <= 1) {
            return new Arc<>(arc.ilabel(), output.length() == 0 ? Arc.EPSILON : output.label(0),
                arc.weight(), arc.nextState());
        }
        int next = arc.nextState();
        for (int i = output.length() - 1; i >= 1; i--) {
            int s = fst.addState();
            fst.addArc(s, new Arc<>(Arc.EPSILON, output.label(i), semiring.one(), next));
            next = s;
        }
        return new Arc<>(arc.ilabel(), output.label(0), arc.weight(), next);
    }

    private static <W> void fail(MutableFst<W> fst, String message) {
        if (Optimizer.DEBUG) {
            System.out.println("DEBUG: " + message);
        }
        fst.setError();
    }
}
