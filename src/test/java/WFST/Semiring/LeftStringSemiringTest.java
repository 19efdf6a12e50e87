package WFST.Semiring;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LeftStringSemiringTest {
  private static final LeftStringSemiring S = LeftStringSemiring.INSTANCE;

  @Test
  void testPlusIsLongestCommonPrefix() {
    Assertions.assertEquals(StringWeight.of(1, 2), S.plus(StringWeight.of(1, 2, 3), StringWeight.of(1, 2, 4)));
    Assertions.assertEquals(StringWeight.EMPTY, S.plus(StringWeight.of(1), StringWeight.of(2)));
    Assertions.assertEquals(StringWeight.of(1), S.plus(StringWeight.of(1), StringWeight.of(1, 5)));
    Assertions.assertEquals(StringWeight.of(7), S.plus(S.zero(), StringWeight.of(7)));
    Assertions.assertTrue(S.isIdempotent());
  }

  @Test
  void testTimesIsConcatenation() {
    Assertions.assertEquals(StringWeight.of(1, 2, 3), S.times(StringWeight.of(1), StringWeight.of(2, 3)));
    Assertions.assertEquals(StringWeight.of(4), S.times(S.one(), StringWeight.of(4)));
    Assertions.assertEquals(S.zero(), S.times(StringWeight.of(4), S.zero()));
    Assertions.assertEquals(StringWeight.EMPTY, StringWeight.ofLabel(0));
  }

  @Test
  void testDivide() {
    StringWeight abc = StringWeight.of(1, 2, 3);
    Assertions.assertEquals(StringWeight.of(3), S.divide(abc, StringWeight.of(1, 2), DivideType.LEFT));
    Assertions.assertEquals(StringWeight.of(1), S.divide(abc, StringWeight.of(2, 3), DivideType.RIGHT));
    Assertions.assertEquals(StringWeight.EMPTY, S.divide(abc, abc, DivideType.LEFT));
    Assertions.assertEquals(abc, S.divide(abc, S.one(), DivideType.LEFT));
    Assertions.assertTrue(S.divide(abc, StringWeight.of(2), DivideType.LEFT).isBad());
    Assertions.assertTrue(S.divide(abc, S.zero(), DivideType.LEFT).isBad());
    Assertions.assertFalse(S.isMember(StringWeight.BAD));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> S.divide(abc, StringWeight.of(1), DivideType.ANY));
  }

  @Test
  void testBadPropagates() {
    Assertions.assertTrue(S.plus(StringWeight.BAD, StringWeight.of(1)).isBad());
    Assertions.assertTrue(S.times(S.zero(), StringWeight.BAD).isBad());
  }

  @Test
  void testEqualityAndToString() {
    Assertions.assertEquals(StringWeight.of(1, 2), StringWeight.of(1, 2));
    Assertions.assertEquals(StringWeight.of(1, 2).hashCode(), StringWeight.of(1, 2).hashCode());
    Assertions.assertNotEquals(StringWeight.INFINITY, StringWeight.EMPTY);
    Assertions.assertEquals("[1, 2]", StringWeight.of(1, 2).toString());
    Assertions.assertEquals("Epsilon", S.one().toString());
    Assertions.assertEquals("Infinity", S.zero().toString());
    Assertions.assertTrue(S.approxEqual(StringWeight.of(3), StringWeight.of(3), Semiring.DELTA));
    Assertions.assertSame(StringWeight.EMPTY, S.quantize(StringWeight.EMPTY, Semiring.DELTA));
  }
}
