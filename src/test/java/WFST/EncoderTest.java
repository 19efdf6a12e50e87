package WFST;

import java.util.Map;

import WFST.Encode.EncodeTable;
import WFST.Encode.EncodeType;
import WFST.Model.Arc;
import WFST.Model.FstProperty;
import WFST.Model.PropertyComputer;
import WFST.Model.VectorFst;
import WFST.Semiring.TropicalSemiring;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static WFST.FstTestUtils.addArc;
import static WFST.FstTestUtils.withStates;

public class EncoderTest {
  private static VectorFst<Float> transducer() {
    VectorFst<Float> fst = withStates(TropicalSemiring.INSTANCE, 3);
    addArc(fst, 0, 1, 2, 1.0f, 1);
    addArc(fst, 0, 1, 3, 1.0f, 1);
    addArc(fst, 1, 1, 2, 1.0f, 2);
    addArc(fst, 1, 1, 2, 0.5f, 2);
    fst.setFinal(2, 0.25f);
    fst.setFinal(1, 0.0f);
    return fst;
  }

  @Test
  void testEncodeLabels() {
    VectorFst<Float> fst = transducer();
    EncodeTable<Float> table = Encoder.encode(fst, EncodeType.LABELS);
    Assertions.assertEquals(2, table.size()); // 1:2 and 1:3
    Assertions.assertTrue(fst.property(FstProperty.ACCEPTOR, false).isTrue());
    Assertions.assertTrue(PropertyComputer.compute(fst).get(FstProperty.ACCEPTOR));
    Assertions.assertEquals(3, fst.numStates());
    Assertions.assertEquals(1.0f, fst.arcs(1).get(0).weight(), FstTestUtils.TOLERANCE);
    Assertions.assertEquals(0.5f, fst.arcs(1).get(1).weight(), FstTestUtils.TOLERANCE);
  }

  @Test
  void testEncodeLabelsAndWeights() {
    VectorFst<Float> fst = transducer();
    EncodeTable<Float> table = Encoder.encode(fst, EncodeType.LABELS_AND_WEIGHTS);
    // 1:2/1, 1:3/1, 1:2/0.5 and the final weights 0.25 and 0
    Assertions.assertEquals(5, table.size());
    Assertions.assertEquals(4, fst.numStates()); // super-final state
    Assertions.assertTrue(fst.property(FstProperty.UNWEIGHTED, false).isTrue());
    Assertions.assertTrue(PropertyComputer.compute(fst).get(FstProperty.UNWEIGHTED));
    Assertions.assertTrue(PropertyComputer.compute(fst).get(FstProperty.ACCEPTOR));
    Assertions.assertTrue(PropertyComputer.compute(fst).get(FstProperty.NO_EPSILONS));
  }

  @Test
  void testRoundTrip() {
    for (EncodeType type : EncodeType.values()) {
      VectorFst<Float> fst = transducer();
      VectorFst<Float> original = fst.copy();
      EncodeTable<Float> table = Encoder.encode(fst, type);
      Encoder.decode(fst, table);
      Assertions.assertFalse(fst.hasError(), type.name());
      FstTestUtils.assertEquivalent(original, fst);
      Assertions.assertEquals(original.numStates(), fst.numStates(), type.name());
    }
  }

  @Test
  void testRoundTripAfterDeterminization() {
    for (int seed = 0; seed < 20; seed++) {
      VectorFst<Float> fst = RandomFst.getRandomFst(seed, TropicalSemiring.INSTANCE, false);
      RmEpsilon.rmEpsilon(fst);
      VectorFst<Float> original = fst.copy();
      EncodeTable<Float> table = Encoder.encode(fst, EncodeType.LABELS_AND_WEIGHTS);
      Optimizer.determinize(fst);
      Encoder.decode(fst, table);
      Assertions.assertFalse(fst.hasError());
      FstTestUtils.assertEquivalent(original, fst);
    }
  }

  @Test
  void testUnknownLabel() {
    VectorFst<Float> fst = transducer();
    EncodeTable<Float> table = Encoder.encode(fst, EncodeType.LABELS);
    fst.addArc(0, new Arc<>(42, 42, 0.0f, 2));
    Encoder.decode(fst, table);
    Assertions.assertTrue(fst.hasError());
  }

  @Test
  void testEpsilonArcsAddedAfterEncodingAreKept() {
    VectorFst<Float> fst = transducer();
    VectorFst<Float> original = fst.copy();
    EncodeTable<Float> table = Encoder.encode(fst, EncodeType.LABELS);
    int start = fst.addState();
    fst.addArc(start, new Arc<>(Arc.EPSILON, Arc.EPSILON, 0.5f, 0));
    fst.setStart(start);

    Encoder.decode(fst, table);
    Assertions.assertFalse(fst.hasError());
    Arc<Float> arc = fst.arcs(fst.start()).get(0);
    Assertions.assertTrue(arc.isEpsilon());
    Assertions.assertEquals(0.5f, arc.weight());

    // the epsilon arc only adds its weight to every path
    Map<FstTestUtils.StringPair, Float> before = FstTestUtils.relation(original);
    Map<FstTestUtils.StringPair, Float> after = FstTestUtils.relation(fst);
    Assertions.assertEquals(before.keySet(), after.keySet());
    for (Map.Entry<FstTestUtils.StringPair, Float> e : before.entrySet()) {
      Assertions.assertEquals(e.getValue() + 0.5f, after.get(e.getKey()), FstTestUtils.TOLERANCE);
    }
  }

  @Test
  void testRmFinalEpsilon() {
    VectorFst<Float> fst = withStates(TropicalSemiring.INSTANCE, 3);
    addArc(fst, 0, 1, 1.0f, 1);
    addArc(fst, 1, Arc.EPSILON, 0.5f, 2);
    fst.setFinal(2, 0.25f);

    Encoder.rmFinalEpsilon(fst);
    Assertions.assertEquals(2, fst.numStates());
    Assertions.assertEquals(0.75f, fst.finalWeight(1), FstTestUtils.TOLERANCE);
  }
}
