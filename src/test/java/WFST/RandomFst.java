package WFST;

import java.util.Random;

import WFST.Model.Arc;
import WFST.Model.VectorFst;
import WFST.Semiring.Semiring;
import net.automatalib.common.util.random.RandomUtil;

/**
 * Random automata in the manner of Tabakov and Vardi (fixed number of arcs and of final states), restricted to
 * arcs from lower to higher states so that the result is acyclic and its relation can be enumerated.
 */
public class RandomFst {
    private RandomFst() {}

    /**
     * @param r - random instance
     * @param semiring - weights are multiples of 0.5 in [0, 2]
     * @param size - number of states, at least 2
     * @param arcNum - number of arcs, at most size * size
     * @param acceptNum - number of final states besides the last one
     * @param alphabetSize - labels are drawn from 1..alphabetSize, or epsilon
     * @param acceptor - whether output labels equal input labels
     * @return a random acyclic automaton, not necessarily connected
     */
    public static VectorFst<Float> generate(Random r, Semiring<Float> semiring, int size, int arcNum, int acceptNum,
                                            int alphabetSize, boolean acceptor) {
        assert size >= 2 && arcNum <= size * size && acceptNum < size;
        VectorFst<Float> result = FstTestUtils.withStates(semiring, size);
        result.setFinal(size - 1, randomWeight(r));
        for (int f : RandomUtil.distinctIntegers(r, acceptNum, 0, size - 1)) {
            result.setFinal(f, randomWeight(r));
        }
        for (int edgeIndex : RandomUtil.distinctIntegers(r, arcNum, size * size)) {
            int from = edgeIndex / size;
            int to = edgeIndex % size;
            if (from == to) {
                continue;
            }
            int ilabel = randomLabel(r, alphabetSize);
            int olabel = acceptor ? ilabel : randomLabel(r, alphabetSize);
            result.addArc(Math.min(from, to), new Arc<>(ilabel, olabel, randomWeight(r), Math.max(from, to)));
        }
        return result;
    }

    public static VectorFst<Float> getRandomFst(int randomSeed, Semiring<Float> semiring, boolean acceptor) {
        final Random random = new Random(randomSeed);
        return generate(random, semiring, 6, 12, 1, 2, acceptor);
    }

    private static int randomLabel(Random r, int alphabetSize) {
        // about one label in six is epsilon
        return r.nextInt(6) == 0 ? Arc.EPSILON : 1 + r.nextInt(alphabetSize);
    }

    private static float randomWeight(Random r) {
        return r.nextInt(5) * 0.5f;
    }
}
