package Solver.Registry;

import java.util.BitSet;

/**
 * Maps subsets of original states to the powerset states created for them.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the powerset state ID registered for a subset.
     * @param subset set of original state IDs
     * @return powerset state ID or MISSING_ELEMENT if the subset has not been registered.
     */
    int get(BitSet subset);

    /**
     * Register a new subset with its (fixed) powerset state ID.
     * @param subset set of original state IDs; must not be mutated afterwards
     * @param stateID powerset state ID
     */
    void put(BitSet subset, int stateID);

    /**
     * @return number of registered subsets
     */
    int size();

    /**
     * Get the subset registered for a powerset state ID.
     * @param stateID powerset state ID
     * @return the subset, or null if the ID is unknown
     */
    BitSet getSubset(int stateID);
}
