package WFST.Semiring;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tropical semiring: min, +, +INF, 0.
 */
public final class TropicalSemiring extends FloatSemiring {
    public static final TropicalSemiring INSTANCE = new TropicalSemiring();

    private static final Set<SemiringProperty> PROPERTIES = Collections.unmodifiableSet(EnumSet.of(
        SemiringProperty.LEFT_SEMIRING, SemiringProperty.RIGHT_SEMIRING, SemiringProperty.COMMUTATIVE,
        SemiringProperty.IDEMPOTENT, SemiringProperty.PATH));

    private TropicalSemiring() {}

    @Override
    public Float plus(Float a, Float b) {
        if (!isMember(a) || !isMember(b)) {
            return BAD_VALUE;
        }
        return Math.min(a, b);
    }

    @Override
    public Set<SemiringProperty> properties() {
        return PROPERTIES;
    }

    @Override
    public String name() {
        return "tropical";
    }
}
