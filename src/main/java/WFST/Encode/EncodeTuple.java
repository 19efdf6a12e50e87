package WFST.Encode;

/**
 * What one encoded label stands for.
 * @param ilabel - input label
 * @param olabel - output label, epsilon when output labels are not encoded
 * @param weight - weight, semiring one when weights are not encoded
 * @param <W> - weight type
 */
public record EncodeTuple<W>(int ilabel, int olabel, W weight) {
}
