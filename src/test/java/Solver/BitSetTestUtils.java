package Solver;

import java.util.BitSet;
import java.util.Collection;

public class BitSetTestUtils {
    // Only for tests, not meant to be performant
    public static BitSet convertListToBitSet(Collection<Integer> list) {
        BitSet b = new BitSet();
        for(int i: list) {
            b.set(i);
        }
        return b;
    }
}
