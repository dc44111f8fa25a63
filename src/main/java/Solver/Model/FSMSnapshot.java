package Solver.Model;

import java.util.ArrayList;
import java.util.List;

import Solver.DeterminismClassifier;

/**
 * Complete structure of a FSM at one point in time. A machine swaps in a new snapshot as a whole, so readers never
 * observe a partially updated machine.
 * @param <I> - Input symbol type
 */
public record FSMSnapshot<I>(List<State> states,
                             List<State> acceptedStates,
                             State startingState,
                             List<Transition<I>> transitions,
                             FSMType type) {

    public FSMSnapshot {
        states = List.copyOf(states);
        acceptedStates = List.copyOf(acceptedStates);
        transitions = List.copyOf(transitions);
    }

    /**
     * Derives the accepted states and the type from the given structure.
     * @param alphabet - alphabet of the machine
     * @param states - dense states, state i at position i
     * @param startingState - start state, null iff there are no states
     * @param transitions - transitions between the given states
     * @return the snapshot
     * @param <I> - Input symbol type
     */
    public static <I> FSMSnapshot<I> of(Alphabet<I> alphabet,
                                        List<State> states,
                                        State startingState,
                                        List<Transition<I>> transitions) {
        final List<State> accepted = new ArrayList<>();
        for (State s : states) {
            if (s.accepting()) {
                accepted.add(s);
            }
        }
        final FSMType type = DeterminismClassifier.classify(states.size(), alphabet, transitions);
        return new FSMSnapshot<>(states, accepted, startingState, transitions, type);
    }

    public int size() {
        return states.size();
    }
}
