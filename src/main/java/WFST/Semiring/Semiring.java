package WFST.Semiring;

import java.util.Set;

/**
 * A semiring over weights of type {@code W}. One instance per weight algebra; it is the capability object
 * algorithms query to decide what they may do, e.g. {@link #isIdempotent()}.
 * @param <W> - weight type
 */
public interface Semiring<W> {
    /**
     * Default tolerance for weight comparison and quantization.
     */
    float DELTA = 1.0f / 1024.0f;

    W zero();

    W one();

    W plus(W a, W b);

    W times(W a, W b);

    /**
     * Division, where defined. Returns a non-member weight (see {@link #isMember(Object)}) on failure,
     * e.g. when dividing by zero.
     */
    W divide(W a, W b, DivideType type);

    /**
     * False for the "bad value" weights produced by undefined operations.
     */
    boolean isMember(W w);

    boolean approxEqual(W a, W b, float delta);

    /**
     * Map a weight to a canonical representative of its delta-neighbourhood, so that nearly equal weights hash
     * and compare equal.
     */
    W quantize(W w, float delta);

    Set<SemiringProperty> properties();

    String name();

    default boolean isIdempotent() {
        return properties().contains(SemiringProperty.IDEMPOTENT);
    }

    default boolean isZero(W w) {
        return zero().equals(w);
    }

    default boolean isOne(W w) {
        return one().equals(w);
    }
}
