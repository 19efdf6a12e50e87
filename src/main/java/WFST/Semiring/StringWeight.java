package WFST.Semiring;

import java.util.Arrays;

/**
 * A string of labels, used as the weight of the left string semiring. {@link #INFINITY} is the semiring zero,
 * {@link #BAD} marks undefined results.
 */
public final class StringWeight {
    public static final StringWeight EMPTY = new StringWeight(new int[0], Kind.FINITE);
    public static final StringWeight INFINITY = new StringWeight(new int[0], Kind.INFINITE);
    public static final StringWeight BAD = new StringWeight(new int[0], Kind.BAD);

    private enum Kind { FINITE, INFINITE, BAD }

    private final int[] labels;
    private final Kind kind;

    private StringWeight(int[] labels, Kind kind) {
        this.labels = labels;
        this.kind = kind;
    }

    public static StringWeight of(int... labels) {
        return labels.length == 0 ? EMPTY : new StringWeight(labels.clone(), Kind.FINITE);
    }

    /**
     * The one-label string, or the empty string for epsilon.
     */
    public static StringWeight ofLabel(int label) {
        return label == 0 ? EMPTY : new StringWeight(new int[]{label}, Kind.FINITE);
    }

    public boolean isInfinite() {
        return kind == Kind.INFINITE;
    }

    public boolean isBad() {
        return kind == Kind.BAD;
    }

    public int length() {
        return labels.length;
    }

    public int label(int index) {
        return labels[index];
    }

    public int[] toArray() {
        return labels.clone();
    }

    StringWeight concat(StringWeight other) {
        if (other.labels.length == 0) {
            return this;
        }
        if (labels.length == 0) {
            return other;
        }
        int[] joined = Arrays.copyOf(labels, labels.length + other.labels.length);
        System.arraycopy(other.labels, 0, joined, labels.length, other.labels.length);
        return new StringWeight(joined, Kind.FINITE);
    }

    StringWeight commonPrefix(StringWeight other) {
        int n = Math.min(labels.length, other.labels.length);
        int i = 0;
        while (i < n && labels[i] == other.labels[i]) {
            i++;
        }
        if (i == labels.length) {
            return this;
        }
        return i == 0 ? EMPTY : new StringWeight(Arrays.copyOf(labels, i), Kind.FINITE);
    }

    boolean startsWith(StringWeight prefix) {
        if (prefix.labels.length > labels.length) {
            return false;
        }
        return Arrays.equals(labels, 0, prefix.labels.length, prefix.labels, 0, prefix.labels.length);
    }

    StringWeight dropPrefix(int count) {
        if (count == 0) {
            return this;
        }
        return count == labels.length ? EMPTY
            : new StringWeight(Arrays.copyOfRange(labels, count, labels.length), Kind.FINITE);
    }

    StringWeight dropSuffix(int count) {
        if (count == 0) {
            return this;
        }
        return count == labels.length ? EMPTY
            : new StringWeight(Arrays.copyOf(labels, labels.length - count), Kind.FINITE);
    }

    boolean endsWith(StringWeight suffix) {
        int offset = labels.length - suffix.labels.length;
        if (offset < 0) {
            return false;
        }
        return Arrays.equals(labels, offset, labels.length, suffix.labels, 0, suffix.labels.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StringWeight)) {
            return false;
        }
        StringWeight that = (StringWeight) o;
        return kind == that.kind && Arrays.equals(labels, that.labels);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INFINITE:
                return "Infinity";
            case BAD:
                return "BadString";
            default:
                return labels.length == 0 ? "Epsilon" : Arrays.toString(labels);
        }
    }
}
