package WFST.Semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Log semiring: -log(e^-a + e^-b), +, +INF, 0. Not idempotent.
 */
public final class LogSemiring extends FloatSemiring {
    public static final LogSemiring INSTANCE = new LogSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
        SemiringProperty.LEFT_SEMIRING, SemiringProperty.RIGHT_SEMIRING, SemiringProperty.COMMUTATIVE));

    private LogSemiring() {}

    @Override
    public Float plus(Float a, Float b) {
        if (!isMember(a) || !isMember(b)) {
            return BAD_VALUE;
        }
        if (a == Float.POSITIVE_INFINITY) {
            return b;
        }
        if (b == Float.POSITIVE_INFINITY) {
            return a;
        }
        double min = Math.min(a, b);
        double diff = Math.abs(a - b);
        return (float) (min - Math.log1p(Math.exp(-diff)));
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public String name() {
        return "log";
    }
}
