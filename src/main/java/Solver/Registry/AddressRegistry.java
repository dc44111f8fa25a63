package Solver.Registry;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class AddressRegistry implements Registry {
    private final Object2IntMap<BitSet> key2Address;
    private final List<BitSet> address2Key;

    public AddressRegistry() {
        this.key2Address = new Object2IntOpenHashMap<>();
        this.key2Address.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.address2Key = new ArrayList<>();
    }

    @Override
    public int get(BitSet subset) {
        return key2Address.getInt(subset);
    }

    @Override
    public void put(BitSet subset, int stateID) {
        if (stateID < 0) {
            throw new IllegalArgumentException("Negative state ID: " + stateID);
        }
        this.key2Address.put(subset, stateID);
        while (address2Key.size() <= stateID) {
            address2Key.add(null);
        }
        this.address2Key.set(stateID, subset);
    }

    @Override
    public int size() {
        return key2Address.size();
    }

    @Override
    public BitSet getSubset(int stateID) {
        return stateID >= 0 && stateID < address2Key.size() ? address2Key.get(stateID) : null;
    }

    @Override
    public String toString() {
        return "Address";
    }
}
