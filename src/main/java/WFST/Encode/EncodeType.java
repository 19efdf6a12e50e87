package WFST.Encode;

/**
 * What an encoding folds into the new labels.
 */
public enum EncodeType {
    /** Both labels: the result is an acceptor. */
    LABELS(true, false),
    /** Input label and weight: the result is unweighted, output labels untouched. */
    WEIGHTS(false, true),
    /** Everything: the result is an unweighted acceptor. */
    LABELS_AND_WEIGHTS(true, true);

    private final boolean labels;
    private final boolean weights;

    EncodeType(boolean labels, boolean weights) {
        this.labels = labels;
        this.weights = weights;
    }

    public boolean encodeLabels() {
        return labels;
    }

    public boolean encodeWeights() {
        return weights;
    }
}
