package WFST;

import WFST.Model.FstProperty;
import WFST.Model.VectorFst;
import WFST.Semiring.TropicalSemiring;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static WFST.FstTestUtils.addArc;
import static WFST.FstTestUtils.withStates;

public class FstTrimTest {
  @Test
  void testConnect() {
    VectorFst<Float> fst = withStates(TropicalSemiring.INSTANCE, 5);
    addArc(fst, 0, 1, 0.0f, 1);
    addArc(fst, 0, 2, 0.0f, 2); // 2 is a dead end
    addArc(fst, 3, 3, 0.0f, 1); // 3 is unreachable
    addArc(fst, 1, 4, 0.0f, 4);
    fst.setFinal(4, 0.0f);

    Assertions.assertEquals(2, FstTrim.connect(fst));
    Assertions.assertEquals(3, fst.numStates());
    Assertions.assertEquals(2, fst.numArcs());
    Assertions.assertEquals(0, fst.start());
    Assertions.assertTrue(fst.isFinal(2));
    Assertions.assertTrue(fst.property(FstProperty.ACCESSIBLE, false).isTrue());
    Assertions.assertTrue(fst.property(FstProperty.COACCESSIBLE, false).isTrue());
  }

  @Test
  void testKeepsKnownFacts() {
    VectorFst<Float> fst = withStates(TropicalSemiring.INSTANCE, 3);
    addArc(fst, 0, 1, 0.0f, 1);
    addArc(fst, 0, 2, 0.0f, 2);
    fst.setFinal(1, 0.0f);
    Assertions.assertTrue(fst.property(FstProperty.ACCEPTOR, true).isTrue());

    FstTrim.connect(fst);
    Assertions.assertEquals(2, fst.numStates());
    Assertions.assertTrue(fst.property(FstProperty.ACCEPTOR, false).isTrue());
    Assertions.assertTrue(fst.property(FstProperty.I_DETERMINISTIC, false).isTrue());
  }

  @Test
  void testNoFinalState() {
    VectorFst<Float> fst = withStates(TropicalSemiring.INSTANCE, 2);
    addArc(fst, 0, 1, 0.0f, 1);

    Assertions.assertEquals(2, FstTrim.connect(fst));
    Assertions.assertEquals(0, fst.numStates());
    Assertions.assertEquals(VectorFst.NO_STATE, fst.start());
  }
}
