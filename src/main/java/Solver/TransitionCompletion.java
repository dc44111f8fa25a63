package Solver;

import java.util.ArrayList;
import java.util.List;

import Solver.Model.Alphabet;
import Solver.Model.FSMSnapshot;
import Solver.Model.State;
import Solver.Model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Totalizes a transition function by routing every undefined (state, symbol) pair into a shared, non-accepting
 * sink state.
 */
public class TransitionCompletion {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransitionCompletion.class);

    private TransitionCompletion() {}

    /**
     * Completes the given machine.
     * A machine without states becomes a single non-accepting state looping on every symbol.
     * Otherwise a sink with id {@code size()} is added (only if needed) and receives a self-loop per symbol.
     * @param alphabet - Input symbols
     * @param machine - machine to complete
     * @return completed machine, or the given one if nothing was missing
     * @param <I> - Input symbol type
     */
    public static <I> FSMSnapshot<I> complete(Alphabet<I> alphabet, FSMSnapshot<I> machine) {
        if (machine.states().isEmpty()) {
            final State single = new State(0, false);
            return FSMSnapshot.of(alphabet, List.of(single), single, selfLoops(alphabet, single));
        }

        final List<State> states = machine.states();
        final int numStates = states.size();
        final int numInputs = alphabet.size();
        final int[] counts = DeterminismClassifier.countTransitions(numStates, alphabet, machine.transitions());

        final List<Transition<I>> completed = new ArrayList<>(machine.transitions());
        State sink = null;
        int underdefinedStates = 0;

        // only the original states are inspected; the sink is total by construction
        for (State state : states) {
            boolean missing = false;
            int countIdx = state.id() * numInputs;
            for (I symbol : alphabet) {
                if (counts[countIdx++] == 0) {
                    if (sink == null) {
                        sink = new State(numStates, false);
                    }
                    completed.add(new Transition<>(state, sink, symbol));
                    missing = true;
                }
            }
            if (missing) {
                underdefinedStates++;
            }
        }

        if (sink == null) {
            return machine;
        }
        completed.addAll(selfLoops(alphabet, sink));

        final List<State> withSink = new ArrayList<>(states);
        withSink.add(sink);

        LOGGER.debug("Completed {} underdefined states via sink state {}", underdefinedStates, sink.id());
        return FSMSnapshot.of(alphabet, withSink, machine.startingState(), completed);
    }

    private static <I> List<Transition<I>> selfLoops(Alphabet<I> alphabet, State state) {
        final List<Transition<I>> loops = new ArrayList<>(alphabet.size());
        for (I symbol : alphabet) {
            loops.add(new Transition<>(state, state, symbol));
        }
        return loops;
    }
}
