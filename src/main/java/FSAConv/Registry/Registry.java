package FSAConv.Registry;

import java.util.BitSet;

/**
 * Maps canonical source-state subsets to the DFA state standing for them.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the DFA state ID registered for a subset.
     * @param subset set of source states
     * @return state ID or MISSING_ELEMENT if the subset is not registered.
     */
    int get(BitSet subset);

    /**
     * Register a new subset under a (fixed) DFA state ID.
     * @param subset set of source states; must not be modified afterwards
     * @param stateID state ID
     */
    void put(BitSet subset, int stateID);

    /**
     * @return the subset registered under {@code stateID}
     */
    BitSet subsetOf(int stateID);

    /**
     * @return number of registered subsets
     */
    int size();
}
