package Solver;

import java.util.BitSet;

public class BitSetUtils {
    private BitSetUtils() {}

    /**
     * Union of the rows selected by the set bits of subset, e.g., all successors of a subset of states.
     * @param subset - indices of the rows to combine
     * @param rows - one bit set per index
     * @return fresh bit set
     */
    public static BitSet unionOf(BitSet subset, BitSet[] rows) {
        final BitSet result = new BitSet();
        for (int i = subset.nextSetBit(0); i >= 0; i = subset.nextSetBit(i + 1)) {
            result.or(rows[i]);
        }
        return result;
    }
}
