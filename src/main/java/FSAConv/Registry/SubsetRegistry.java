package FSAConv.Registry;

import java.util.BitSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;

public class SubsetRegistry implements Registry {
    private final Object2IntMap<BitSet> subset2State;
    private final ObjectList<BitSet> state2Subset;

    public SubsetRegistry() {
        this.subset2State = new Object2IntOpenHashMap<>();
        this.subset2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.state2Subset = new ObjectArrayList<>();
    }

    @Override
    public int get(BitSet subset) {
        return subset2State.getInt(subset);
    }

    @Override
    public void put(BitSet subset, int stateID) {
        if (stateID != state2Subset.size()) {
            throw new IllegalArgumentException("State IDs must be registered densely, expected "
                    + state2Subset.size() + " but got " + stateID);
        }
        this.subset2State.put(subset, stateID);
        this.state2Subset.add(subset);
    }

    @Override
    public BitSet subsetOf(int stateID) {
        return state2Subset.get(stateID);
    }

    @Override
    public int size() {
        return state2Subset.size();
    }

    @Override
    public String toString() {
        return "Subsets" + state2Subset;
    }
}
