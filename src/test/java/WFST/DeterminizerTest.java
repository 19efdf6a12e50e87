package WFST;

import java.util.Map;

import WFST.Model.DeterminizeOptions;
import WFST.Model.FstProperty;
import WFST.Model.PropertyComputer;
import WFST.Model.VectorFst;
import WFST.Semiring.LogSemiring;
import WFST.Semiring.Semiring;
import WFST.Semiring.TropicalSemiring;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static WFST.FstTestUtils.addArc;
import static WFST.FstTestUtils.withStates;

public class DeterminizerTest {
  // (a|b)*a(a|b): the classic blow-up example, 2^(n+1) subsets for n trailing letters
  private static VectorFst<Float> nthFromEnd(Semiring<Float> semiring) {
    VectorFst<Float> fst = withStates(semiring, 3);
    addArc(fst, 0, 1, 0.0f, 0);
    addArc(fst, 0, 2, 0.0f, 0);
    addArc(fst, 0, 1, 0.0f, 1);
    addArc(fst, 1, 1, 0.0f, 2);
    addArc(fst, 1, 2, 0.0f, 2);
    fst.setFinal(2, 0.0f);
    return fst;
  }

  @Test
  void testPowerset() {
    VectorFst<Float> in = nthFromEnd(TropicalSemiring.INSTANCE);
    VectorFst<Float> out = new VectorFst<>(TropicalSemiring.INSTANCE);
    Determinizer.determinize(in, out);

    Assertions.assertFalse(out.hasError());
    Assertions.assertEquals(4, out.numStates());
    Assertions.assertEquals(8, out.numArcs());
    Map<FstProperty, Boolean> props = PropertyComputer.compute(out);
    Assertions.assertTrue(props.get(FstProperty.I_DETERMINISTIC));
    Assertions.assertTrue(props.get(FstProperty.UNWEIGHTED));
    Assertions.assertTrue(out.property(FstProperty.I_DETERMINISTIC, false).isTrue());
    // the input is untouched
    Assertions.assertEquals(nthFromEnd(TropicalSemiring.INSTANCE), in);
  }

  @Test
  void testWeighted() {
    VectorFst<Float> in = withStates(TropicalSemiring.INSTANCE, 4);
    addArc(in, 0, 1, 1.0f, 1);
    addArc(in, 0, 1, 3.0f, 2);
    addArc(in, 1, 2, 1.0f, 3);
    addArc(in, 2, 2, 0.5f, 3);
    addArc(in, 2, 3, 0.0f, 3);
    in.setFinal(3, 0.0f);
    VectorFst<Float> out = new VectorFst<>(TropicalSemiring.INSTANCE);
    Determinizer.determinize(in, out);

    Assertions.assertFalse(out.hasError());
    Assertions.assertEquals(3, out.numStates());
    Assertions.assertEquals(1.0f, out.arcs(out.start()).get(0).weight(), FstTestUtils.TOLERANCE);
    Assertions.assertTrue(PropertyComputer.compute(out).get(FstProperty.I_DETERMINISTIC));
    FstTestUtils.assertEquivalent(in, out);
  }

  @Test
  void testWeightedLog() {
    for (int seed = 0; seed < 20; seed++) {
      VectorFst<Float> in = RandomFst.getRandomFst(seed, LogSemiring.INSTANCE, true);
      RmEpsilon.rmEpsilon(in);
      VectorFst<Float> out = new VectorFst<>(LogSemiring.INSTANCE);
      Determinizer.determinize(in, out);
      Assertions.assertFalse(out.hasError());
      Assertions.assertTrue(PropertyComputer.compute(out).get(FstProperty.I_DETERMINISTIC));
      FstTestUtils.assertEquivalent(in, out);
    }
  }

  @Test
  void testTransducerIsAnError() {
    VectorFst<Float> in = withStates(TropicalSemiring.INSTANCE, 2);
    addArc(in, 0, 1, 2, 0.0f, 1);
    in.setFinal(1, 0.0f);
    VectorFst<Float> out = new VectorFst<>(TropicalSemiring.INSTANCE);
    Determinizer.determinize(in, out);
    Assertions.assertTrue(out.hasError());
    Assertions.assertEquals(0, out.numStates());
  }

  @Test
  void testStateThreshold() {
    VectorFst<Float> in = nthFromEnd(TropicalSemiring.INSTANCE);
    VectorFst<Float> out = new VectorFst<>(TropicalSemiring.INSTANCE);
    Determinizer.determinize(in, out, new DeterminizeOptions(Semiring.DELTA, 2));
    Assertions.assertTrue(out.hasError());

    out = new VectorFst<>(TropicalSemiring.INSTANCE);
    Determinizer.determinize(in, out, new DeterminizeOptions(Semiring.DELTA, 4));
    Assertions.assertFalse(out.hasError());
  }

  @Test
  void testSameAutomaton() {
    VectorFst<Float> fst = nthFromEnd(TropicalSemiring.INSTANCE);
    Assertions.assertThrows(IllegalArgumentException.class, () -> Determinizer.determinize(fst, fst));
  }

  @Test
  void testInvalidOptions() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new DeterminizeOptions(0.0f, 10));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new DeterminizeOptions(Semiring.DELTA, 0));
  }
}
