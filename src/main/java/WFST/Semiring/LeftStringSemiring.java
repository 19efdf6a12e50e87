package WFST.Semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Left string semiring: longest common prefix, concatenation, infinity, epsilon. Used to push output labels
 * towards the initial state.
 */
public final class LeftStringSemiring implements Semiring<StringWeight> {
    public static final LeftStringSemiring INSTANCE = new LeftStringSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
        SemiringProperty.LEFT_SEMIRING, SemiringProperty.IDEMPOTENT));

    private LeftStringSemiring() {}

    @Override
    public StringWeight zero() {
        return StringWeight.INFINITY;
    }

    @Override
    public StringWeight one() {
        return StringWeight.EMPTY;
    }

    @Override
    public StringWeight plus(StringWeight a, StringWeight b) {
        if (a.isBad() || b.isBad()) {
            return StringWeight.BAD;
        }
        if (a.isInfinite()) {
            return b;
        }
        if (b.isInfinite()) {
            return a;
        }
        return a.commonPrefix(b);
    }

    @Override
    public StringWeight times(StringWeight a, StringWeight b) {
        if (a.isBad() || b.isBad()) {
            return StringWeight.BAD;
        }
        if (a.isInfinite() || b.isInfinite()) {
            return StringWeight.INFINITY;
        }
        return a.concat(b);
    }

    @Override
    public StringWeight divide(StringWeight a, StringWeight b, DivideType type) {
        if (a.isBad() || b.isBad() || b.isInfinite()) {
            return StringWeight.BAD;
        }
        if (a.isInfinite()) {
            return StringWeight.INFINITY;
        }
        switch (type) {
            case LEFT:
                return a.startsWith(b) ? a.dropPrefix(b.length()) : StringWeight.BAD;
            case RIGHT:
                return a.endsWith(b) ? a.dropSuffix(b.length()) : StringWeight.BAD;
            default:
                throw new IllegalArgumentException("Left string semiring only supports LEFT or RIGHT division");
        }
    }

    @Override
    public boolean isMember(StringWeight w) {
        return w != null && !w.isBad();
    }

    @Override
    public boolean approxEqual(StringWeight a, StringWeight b, float delta) {
        return a.equals(b);
    }

    @Override
    public StringWeight quantize(StringWeight w, float delta) {
        return w;
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public String name() {
        return "left_string";
    }

    @Override
    public String toString() {
        return name();
    }
}
