package Solver;

import java.util.ArrayList;
import java.util.List;

import Solver.Model.Alphabet;
import Solver.Model.FSMSnapshot;
import Solver.Model.FSMType;
import Solver.Model.State;
import Solver.Model.StatePartition;
import Solver.Model.Transition;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moore's partition refinement. Starting from accepting vs. non-accepting states, groups are split by the groups
 * their successors fall into until the partition no longer changes. Each final group becomes one state.
 */
public class MooreMinimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(MooreMinimizer.class);

    private MooreMinimizer() {}

    /**
     * Minimize a deterministic machine.
     * @param alphabet - Input symbols; their order is the column order of the signatures
     * @param dfa - deterministic machine
     * @return minimized machine. State i is the i-th group of the stable partition.
     * @throws IllegalStateException if the machine is not deterministic
     * @param <I> - Input symbol type
     */
    public static <I> FSMSnapshot<I> minimize(Alphabet<I> alphabet, FSMSnapshot<I> dfa) {
        if (dfa.type() != FSMType.DETERMINISTIC) {
            throw new IllegalStateException("minimization requires a deterministic machine");
        }
        final int[][] successors = successorTable(alphabet, dfa);

        StatePartition current = StatePartition.byAcceptance(dfa.states());
        int[][] signatures = signatures(current, successors);
        StatePartition refined = current.refine(signatures);
        int rounds = 1;

        // groups only ever split, so this terminates after at most size() rounds
        while (!refined.equals(current)) {
            current = refined;
            signatures = signatures(current, successors);
            refined = current.refine(signatures);
            rounds++;
        }

        // refined equals current here, so the signatures index the groups of the final partition
        final int numGroups = refined.size();
        final List<State> states = new ArrayList<>(numGroups);
        for (int g = 0; g < numGroups; g++) {
            boolean accepting = false;
            for (int member : refined.getGroup(g)) {
                accepting |= dfa.states().get(member).accepting();
            }
            states.add(new State(g, accepting));
        }

        final List<Transition<I>> transitions = new ArrayList<>(numGroups * alphabet.size());
        for (State s : states) {
            final IntList group = refined.getGroup(s.id());
            final int[] row = signatures[group.getInt(0)];
            for (int j = 0; j < row.length; j++) {
                transitions.add(new Transition<>(s, states.get(row[j]), alphabet.getSymbol(j)));
            }
        }

        final State start = states.get(refined.groupOf(dfa.startingState().id()));
        LOGGER.debug("Moore refinement stable after {} rounds: {} -> {} states", rounds, dfa.size(), numGroups);
        return FSMSnapshot.of(alphabet, states, start, transitions);
    }

    /**
     * signatures[q][j] is the index of the group holding the successor of q on the j-th symbol.
     */
    static int[][] signatures(StatePartition partition, int[][] successors) {
        final int[][] signatures = new int[successors.length][];
        for (int q = 0; q < successors.length; q++) {
            final int[] succ = successors[q];
            final int[] signature = new int[succ.length];
            for (int j = 0; j < succ.length; j++) {
                signature[j] = partition.groupOf(succ[j]);
            }
            signatures[q] = signature;
        }
        return signatures;
    }

    private static <I> int[][] successorTable(Alphabet<I> alphabet, FSMSnapshot<I> dfa) {
        final int[][] successors = new int[dfa.size()][alphabet.size()];
        for (Transition<I> t : dfa.transitions()) {
            successors[t.start().id()][alphabet.indexOf(t.symbol())] = t.end().id();
        }
        return successors;
    }
}
