package WFST.Model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Known property values of one automaton. Absent entries are unknown. The error flag is kept apart, since no
 * mutation can make a failed automaton valid again.
 */
public final class PropertyCache {
    private final EnumMap<FstProperty, Boolean> known = new EnumMap<>(FstProperty.class);
    private boolean error;

    public Ternary get(FstProperty property) {
        if (property == FstProperty.ERROR) {
            return Ternary.of(error);
        }
        Boolean value = known.get(property);
        return value == null ? Ternary.UNKNOWN : Ternary.of(value);
    }

    public void set(FstProperty property, boolean value) {
        if (property == FstProperty.ERROR) {
            error |= value;
        } else {
            known.put(property, value);
        }
    }

    public void setAll(Map<FstProperty, Boolean> values) {
        for (Map.Entry<FstProperty, Boolean> e : values.entrySet()) {
            set(e.getKey(), e.getValue());
        }
    }

    /**
     * @return true iff every property of the mask has a known value
     */
    public boolean isKnown(Set<FstProperty> mask) {
        for (FstProperty p : mask) {
            if (get(p) == Ternary.UNKNOWN) {
                return false;
            }
        }
        return true;
    }

    public boolean hasError() {
        return error;
    }

    /**
     * Forget everything but the error flag.
     */
    public void invalidate() {
        known.clear();
    }

    public Map<FstProperty, Boolean> snapshot() {
        return known.isEmpty() ? Collections.emptyMap() : new EnumMap<>(known);
    }

    /**
     * Re-assert the facts of a snapshot that the caller knows survived its rewrite.
     * @param snapshot - facts taken before the rewrite
     * @param preserved - properties the rewrite cannot change
     */
    public void restore(Map<FstProperty, Boolean> snapshot, Set<FstProperty> preserved) {
        for (Map.Entry<FstProperty, Boolean> e : snapshot.entrySet()) {
            if (preserved.contains(e.getKey())) {
                known.put(e.getKey(), e.getValue());
            }
        }
    }

    /**
     * Like {@link #restore(Map, Set)}, but only for facts that were true. For rewrites that only delete, where
     * a property that failed before may hold afterwards.
     */
    public void restoreTrue(Map<FstProperty, Boolean> snapshot, Set<FstProperty> preserved) {
        for (Map.Entry<FstProperty, Boolean> e : snapshot.entrySet()) {
            if (e.getValue() && preserved.contains(e.getKey())) {
                known.put(e.getKey(), true);
            }
        }
    }

    public void copyFrom(PropertyCache other) {
        known.clear();
        known.putAll(other.known);
        error = other.error;
    }

    @Override
    public String toString() {
        return error ? known + " ERROR" : known.toString();
    }
}
