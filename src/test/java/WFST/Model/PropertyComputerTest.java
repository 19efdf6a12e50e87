package WFST.Model;

import java.util.Map;

import WFST.Semiring.TropicalSemiring;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PropertyComputerTest {
  private static VectorFst<Float> withStates(int n) {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    for (int i = 0; i < n; i++) {
      fst.addState();
    }
    fst.setStart(0);
    return fst;
  }

  @Test
  void testEmpty() {
    Map<FstProperty, Boolean> props = PropertyComputer.compute(new VectorFst<>(TropicalSemiring.INSTANCE));
    Assertions.assertEquals(FstProperty.COMPUTABLE, props.keySet());
    for (Boolean value : props.values()) {
      Assertions.assertTrue(value);
    }
  }

  @Test
  void testTransducer() {
    VectorFst<Float> fst = withStates(3);
    fst.addArc(0, new Arc<>(2, 1, 0.0f, 1));
    fst.addArc(0, new Arc<>(1, 1, 0.0f, 2));
    fst.addArc(1, new Arc<>(0, 0, 0.0f, 2));
    fst.setFinal(2, 0.0f);

    Map<FstProperty, Boolean> props = PropertyComputer.compute(fst);
    Assertions.assertFalse(props.get(FstProperty.ACCEPTOR));
    Assertions.assertFalse(props.get(FstProperty.NO_EPSILONS));
    Assertions.assertTrue(props.get(FstProperty.I_DETERMINISTIC));
    Assertions.assertFalse(props.get(FstProperty.O_DETERMINISTIC));
    Assertions.assertFalse(props.get(FstProperty.I_LABEL_SORTED));
    Assertions.assertTrue(props.get(FstProperty.O_LABEL_SORTED));
    Assertions.assertTrue(props.get(FstProperty.ACYCLIC));
    Assertions.assertTrue(props.get(FstProperty.INITIAL_ACYCLIC));
    Assertions.assertTrue(props.get(FstProperty.UNWEIGHTED));
    Assertions.assertTrue(props.get(FstProperty.ACCESSIBLE));
    Assertions.assertTrue(props.get(FstProperty.COACCESSIBLE));
  }

  @Test
  void testCycles() {
    VectorFst<Float> fst = withStates(4);
    fst.addArc(0, new Arc<>(1, 1, 0.0f, 1));
    fst.addArc(1, new Arc<>(1, 1, 0.0f, 2));
    fst.addArc(2, new Arc<>(1, 1, 0.0f, 1)); // unweighted cycle 1 -> 2 -> 1
    fst.addArc(2, new Arc<>(2, 2, 1.0f, 3));
    fst.setFinal(2, 0.0f);

    Map<FstProperty, Boolean> props = PropertyComputer.compute(fst);
    Assertions.assertFalse(props.get(FstProperty.ACYCLIC));
    Assertions.assertTrue(props.get(FstProperty.INITIAL_ACYCLIC));
    Assertions.assertTrue(props.get(FstProperty.UNWEIGHTED_CYCLES));
    Assertions.assertFalse(props.get(FstProperty.UNWEIGHTED));
    Assertions.assertFalse(props.get(FstProperty.COACCESSIBLE)); // 3 is a dead end

    fst.addArc(3, new Arc<>(3, 3, 0.5f, 0));
    props = PropertyComputer.compute(fst);
    Assertions.assertFalse(props.get(FstProperty.INITIAL_ACYCLIC));
    Assertions.assertFalse(props.get(FstProperty.UNWEIGHTED_CYCLES));
    Assertions.assertTrue(props.get(FstProperty.COACCESSIBLE));
  }

  @Test
  void testSelfLoopOnStart() {
    VectorFst<Float> fst = withStates(1);
    fst.addArc(0, new Arc<>(1, 1, 0.0f, 0));
    Map<FstProperty, Boolean> props = PropertyComputer.compute(fst);
    Assertions.assertFalse(props.get(FstProperty.ACYCLIC));
    Assertions.assertFalse(props.get(FstProperty.INITIAL_ACYCLIC));
    Assertions.assertTrue(props.get(FstProperty.ACCESSIBLE));
    Assertions.assertFalse(props.get(FstProperty.COACCESSIBLE));
  }

  @Test
  void testStronglyConnectedComponents() {
    VectorFst<Float> fst = withStates(5);
    fst.addArc(0, new Arc<>(1, 1, 0.0f, 1));
    fst.addArc(1, new Arc<>(1, 1, 0.0f, 2));
    fst.addArc(2, new Arc<>(1, 1, 0.0f, 0));
    fst.addArc(2, new Arc<>(1, 1, 0.0f, 3));
    fst.addArc(4, new Arc<>(1, 1, 0.0f, 4));

    int[] component = PropertyComputer.stronglyConnectedComponents(fst);
    Assertions.assertEquals(component[0], component[1]);
    Assertions.assertEquals(component[0], component[2]);
    Assertions.assertNotEquals(component[0], component[3]);
    Assertions.assertNotEquals(component[0], component[4]);
    Assertions.assertNotEquals(component[3], component[4]);
  }
}
