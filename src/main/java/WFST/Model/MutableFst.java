package WFST.Model;

import java.util.BitSet;
import java.util.List;

/**
 * A weighted automaton that can be rewritten in place. Every mutation invalidates the cached properties, except
 * the error flag.
 * @param <W> - weight type
 */
public interface MutableFst<W> extends Fst<W> {

    int addState();

    void setStart(int state);

    void setFinal(int state, W weight);

    void addArc(int state, Arc<W> arc);

    /**
     * Replace all arcs leaving a state.
     */
    void setArcs(int state, List<Arc<W>> arcs);

    void deleteArcs(int state);

    /**
     * Delete states and the arcs into them. Survivors keep their relative order and are renumbered densely.
     */
    void deleteStates(BitSet states);

    void deleteAllStates();

    /**
     * Take over the contents of another automaton, including its known properties.
     */
    void assign(Fst<W> other);

    MutableFst<W> copy();

    /**
     * Direct access to the cache, for rewrites that know which facts they establish or preserve.
     */
    PropertyCache propertyCache();

    default void setProperty(FstProperty property, boolean value) {
        propertyCache().set(property, value);
    }

    default void setError() {
        propertyCache().set(FstProperty.ERROR, true);
    }
}
