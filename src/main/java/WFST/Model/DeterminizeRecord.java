package WFST.Model;

/**
 * A subset waiting to be expanded, with the output state already allocated for it.
 * @param inputState - the subset
 * @param outputAddress - its state in the result
 * @param <S> - subset representation
 */
public record DeterminizeRecord<S>(S inputState, int outputAddress) {
    @Override
    public String toString() {
        return "(" + inputState + " -> " + outputAddress + ")";
    }
}
