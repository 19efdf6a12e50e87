package WFST.Semiring;

/**
 * Shared behaviour of the semirings over -log probabilities: zero is +infinity, one is 0, times is addition
 * and division is subtraction.
 */
abstract class FloatSemiring implements Semiring<Float> {
    static final Float ZERO = Float.POSITIVE_INFINITY;
    static final Float ONE = 0.0f;
    static final Float BAD_VALUE = Float.NaN;

    @Override
    public Float zero() {
        return ZERO;
    }

    @Override
    public Float one() {
        return ONE;
    }

    @Override
    public Float times(Float a, Float b) {
        if (!isMember(a) || !isMember(b)) {
            return BAD_VALUE;
        }
        if (a == Float.POSITIVE_INFINITY || b == Float.POSITIVE_INFINITY) {
            return ZERO;
        }
        return a + b;
    }

    @Override
    public Float divide(Float a, Float b, DivideType type) {
        if (!isMember(a) || !isMember(b) || b == Float.POSITIVE_INFINITY) {
            return BAD_VALUE;
        }
        if (a == Float.POSITIVE_INFINITY) {
            return ZERO;
        }
        return a - b;
    }

    @Override
    public boolean isMember(Float w) {
        return w != null && !w.isNaN() && w != Float.NEGATIVE_INFINITY;
    }

    @Override
    public boolean approxEqual(Float a, Float b, float delta) {
        if (a.equals(b)) {
            return true;
        }
        return a <= b + delta && b <= a + delta;
    }

    @Override
    public Float quantize(Float w, float delta) {
        if (!isMember(w) || w == Float.POSITIVE_INFINITY) {
            return w;
        }
        float q = (float) Math.floor(w / delta + 0.5f) * delta;
        // keep -0.0f from producing a second "one"
        return q == 0.0f ? ONE : q;
    }

    @Override
    public String toString() {
        return name();
    }
}
