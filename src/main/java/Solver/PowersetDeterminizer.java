package Solver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import Solver.Model.Alphabet;
import Solver.Model.Cancellation;
import Solver.Model.DeterminizeRecord;
import Solver.Model.FSMSnapshot;
import Solver.Model.State;
import Solver.Model.Transition;
import Solver.Registry.AddressRegistry;
import Solver.Registry.Registry;
import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.booleans.BooleanList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction over complete machines. Each reachable subset of original states becomes one powerset state;
 * the subset of the start state becomes powerset state 0.
 */
public class PowersetDeterminizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PowersetDeterminizer.class);

    private final Cancellation cancellation;

    public PowersetDeterminizer() {
        this(new Cancellation());
    }

    public PowersetDeterminizer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    public <I> FSMSnapshot<I> determinize(Alphabet<I> alphabet, FSMSnapshot<I> machine) {
        return determinize(alphabet, machine, new AddressRegistry());
    }

    /**
     * Determinize a machine whose start state is set.
     * @param alphabet - Input symbols
     * @param machine - machine with a start state; usually complete, see {@link TransitionCompletion}
     * @param registry - empty subset to powerset state table, filled during the construction
     * @return deterministic machine holding only reachable powerset states
     * @throws IllegalStateException if the cancellation trips before the construction finishes
     * @param <I> - Input symbol type
     */
    public <I> FSMSnapshot<I> determinize(Alphabet<I> alphabet, FSMSnapshot<I> machine, Registry registry) {
        final State start = machine.startingState();
        if (start == null) {
            throw new IllegalArgumentException("Powerset construction requires a start state");
        }
        final int numInputs = alphabet.size();
        final BitSet[][] successors = successorTable(alphabet, machine);
        final BitSet accepting = new BitSet();
        for (State s : machine.acceptedStates()) {
            accepting.set(s.id());
        }

        final BooleanList outAccepting = new BooleanArrayList();
        final IntList outTransitions = new IntArrayList();
        final Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        final BitSet init = new BitSet();
        init.set(start.id());
        registry.put(init, 0);
        outAccepting.add(init.intersects(accepting));
        stack.push(new DeterminizeRecord(init, 0));

        while (!stack.isEmpty()) {
            if (cancellation.isInterrupted() || cancellation.isAboveThreshold(registry.size())) {
                throw new IllegalStateException("Powerset construction cancelled ("
                        + cancellation.cancelLabel() + ") after " + registry.size() + " states");
            }
            final DeterminizeRecord curr = stack.pop();
            final BitSet inState = curr.inputState();
            final int outState = curr.outputAddress();

            int transitionIdx = outState * numInputs;
            if (outTransitions.size() < transitionIdx + numInputs) {
                outTransitions.size(transitionIdx + numInputs);
            }
            for (int j = 0; j < numInputs; j++) {
                final BitSet succ = BitSetUtils.unionOf(inState, successors[j]);
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to stack
                    outSucc = registry.size();
                    registry.put(succ, outSucc);
                    outAccepting.add(succ.intersects(accepting));
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                outTransitions.set(transitionIdx++, outSucc);
            }
        }

        final int numOut = outAccepting.size();
        final List<State> states = new ArrayList<>(numOut);
        for (int i = 0; i < numOut; i++) {
            states.add(new State(i, outAccepting.getBoolean(i)));
        }
        final List<Transition<I>> transitions = new ArrayList<>(numOut * numInputs);
        for (State s : states) {
            int transitionIdx = s.id() * numInputs;
            for (I symbol : alphabet) {
                transitions.add(new Transition<>(s, states.get(outTransitions.getInt(transitionIdx++)), symbol));
            }
        }

        LOGGER.debug("Powerset construction: {} states -> {} reachable powerset states", machine.size(), numOut);
        return FSMSnapshot.of(alphabet, states, states.get(0), transitions);
    }

    /**
     * successors[j][q] holds every state reachable from q on the j-th symbol.
     */
    private static <I> BitSet[][] successorTable(Alphabet<I> alphabet, FSMSnapshot<I> machine) {
        final int numStates = machine.size();
        final BitSet[][] successors = new BitSet[alphabet.size()][numStates];
        for (BitSet[] row : successors) {
            for (int q = 0; q < numStates; q++) {
                row[q] = new BitSet();
            }
        }
        for (Transition<I> t : machine.transitions()) {
            successors[alphabet.indexOf(t.symbol())][t.start().id()].set(t.end().id());
        }
        return successors;
    }
}
