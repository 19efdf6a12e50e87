package WFST.Semiring;

public enum DivideType {
    /** Solve b * x = a, i.e. remove b from the left of a. */
    LEFT,
    /** Solve x * b = a, i.e. remove b from the right of a. */
    RIGHT,
    /** Only valid for commutative semirings. */
    ANY
}
