package WFST.Model;

/**
 * A transition. Label 0 is epsilon.
 * @param ilabel - input label
 * @param olabel - output label
 * @param weight - semiring weight
 * @param nextState - destination state
 * @param <W> - weight type
 */
public record Arc<W>(int ilabel, int olabel, W weight, int nextState) {
    public static final int EPSILON = 0;

    public Arc {
        if (weight == null) {
            throw new IllegalArgumentException("Arc weight must not be null");
        }
        if (ilabel < 0 || olabel < 0) {
            throw new IllegalArgumentException("Labels must be non-negative: " + ilabel + ":" + olabel);
        }
    }

    public boolean isEpsilon() {
        return ilabel == EPSILON && olabel == EPSILON;
    }

    public Arc<W> withWeight(W newWeight) {
        return new Arc<>(ilabel, olabel, newWeight, nextState);
    }

    public Arc<W> withLabels(int newIlabel, int newOlabel) {
        return new Arc<>(newIlabel, newOlabel, weight, nextState);
    }

    public Arc<W> withNextState(int newNextState) {
        return new Arc<>(ilabel, olabel, weight, newNextState);
    }

    @Override
    public String toString() {
        return ilabel + ":" + olabel + "/" + weight + " -> " + nextState;
    }
}
