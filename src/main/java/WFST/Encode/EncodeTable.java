package WFST.Encode;

import java.util.ArrayList;
import java.util.List;

import WFST.Semiring.Semiring;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Bijection between encoded tuples and fresh labels 1, 2, 3, ... Built while encoding, read while decoding;
 * one table belongs to exactly one encode/decode bracket.
 * @param <W> - weight type
 */
public class EncodeTable<W> {
    public static final int MISSING_ELEMENT = -1;

    private final EncodeType type;
    private final Semiring<W> semiring;
    private final Object2IntMap<EncodeTuple<W>> tuple2Label;
    private final List<EncodeTuple<W>> label2Tuple;

    public EncodeTable(EncodeType type, Semiring<W> semiring) {
        this.type = type;
        this.semiring = semiring;
        this.tuple2Label = new Object2IntOpenHashMap<>();
        this.tuple2Label.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.label2Tuple = new ArrayList<>();
    }

    public EncodeType type() {
        return type;
    }

    public Semiring<W> semiring() {
        return semiring;
    }

    /**
     * Label for a tuple, allocating the next free label on first sight. Parts the type does not encode are
     * normalized away first.
     */
    public int encode(int ilabel, int olabel, W weight) {
        EncodeTuple<W> tuple = new EncodeTuple<>(ilabel,
            type.encodeLabels() ? olabel : 0,
            type.encodeWeights() ? weight : semiring.one());
        int label = tuple2Label.getInt(tuple);
        if (label == MISSING_ELEMENT) {
            label2Tuple.add(tuple);
            label = label2Tuple.size();
            tuple2Label.put(tuple, label);
        }
        return label;
    }

    /**
     * @return the tuple behind a label, or null if this table never produced it
     */
    public EncodeTuple<W> decode(int label) {
        if (label < 1 || label > label2Tuple.size()) {
            return null;
        }
        return label2Tuple.get(label - 1);
    }

    /**
     * @return number of labels handed out; they are exactly 1..size()
     */
    public int size() {
        return label2Tuple.size();
    }

    @Override
    public String toString() {
        return "EncodeTable(" + type + ", " + size() + " labels)";
    }
}
