package WFST.Semiring;

/**
 * Algebraic capabilities of a semiring. These are facts about the weight type, never about a single weight.
 */
public enum SemiringProperty {
    /** Times left-distributes over plus. */
    LEFT_SEMIRING,
    /** Times right-distributes over plus. */
    RIGHT_SEMIRING,
    /** Times is commutative. */
    COMMUTATIVE,
    /** a + a = a for every a. */
    IDEMPOTENT,
    /** a + b is either a or b. */
    PATH
}
