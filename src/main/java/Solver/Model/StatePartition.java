package Solver.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Ordered list of disjoint, ordered groups of state ids used by Moore's partition refinement.
 * Two partitions are equal iff they have the same groups, holding the same states, in the same order.
 */
public final class StatePartition {

    private final List<IntList> groups;
    private final int[] groupOfState;

    private StatePartition(List<IntList> groups, int numStates) {
        this.groups = Collections.unmodifiableList(groups);
        this.groupOfState = new int[numStates];
        for (int g = 0; g < groups.size(); g++) {
            for (int state : groups.get(g)) {
                groupOfState[state] = g;
            }
        }
    }

    /**
     * Initial partition: accepting vs. non-accepting states, ordered by first appearance. Empty groups are dropped.
     */
    public static StatePartition byAcceptance(List<State> states) {
        final Map<Boolean, IntList> split = new LinkedHashMap<>(4);
        for (State s : states) {
            split.computeIfAbsent(s.accepting(), k -> new IntArrayList()).add(s.id());
        }
        return new StatePartition(new ArrayList<>(split.values()), states.size());
    }

    /**
     * Splits every group into sub-groups of states with equal signatures. Sub-groups keep the order in which they
     * first appear within their group; groups keep their relative order.
     * @param signatures - signature per state id
     * @return refined partition
     */
    public StatePartition refine(int[][] signatures) {
        final List<IntList> refined = new ArrayList<>(groups.size());
        for (IntList group : groups) {
            final Map<IntList, IntList> bySignature = new LinkedHashMap<>();
            for (int state : group) {
                final IntList key = IntArrayList.wrap(signatures[state]);
                bySignature.computeIfAbsent(key, k -> new IntArrayList()).add(state);
            }
            refined.addAll(bySignature.values());
        }
        return new StatePartition(refined, groupOfState.length);
    }

    public int groupOf(int state) {
        return groupOfState[state];
    }

    public IntList getGroup(int index) {
        return groups.get(index);
    }

    public List<IntList> getGroups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatePartition)) {
            return false;
        }
        return groups.equals(((StatePartition) o).groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return groups.toString();
    }
}
