package Solver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import Solver.Model.Alphabet;
import Solver.Model.Cancellation;
import Solver.Model.FSMSnapshot;
import Solver.Model.FSMType;
import Solver.Model.State;
import Solver.Model.Transition;
import Solver.Model.TransitionTriple;

/**
 * A finite state machine, deterministic or not. Whether it is deterministic follows from its states and
 * transitions, so a single class covers both.
 * <p>
 * Instances are created by {@link #create} and afterwards only changed by {@link #makeDeterministic()} and
 * {@link #minimize()}. Each of these replaces the whole structure at once. Not safe for concurrent mutation.
 * @param <I> - Input symbol type, e.g., Character
 */
public class FSM<I> {
    private final Alphabet<I> alphabet;
    private FSMSnapshot<I> structure;
    private boolean minimized;

    private FSM(Alphabet<I> alphabet, FSMSnapshot<I> structure) {
        this.alphabet = alphabet;
        this.structure = structure;
    }

    /**
     * Creates a new machine after checking that the description is consistent.
     * Nothing is built unless every check passes.
     * @param alphabet - alphabet of the machine, must not be null
     * @param numberOfStates - number of states, zero or greater
     * @param acceptedStates - accepting state ids, at most numberOfStates of them; null means none
     * @param startState - start state id in [0, numberOfStates); ignored if numberOfStates is 0
     * @param transitions - (from, to, symbol) triples; null means none
     * @return the machine
     * @see FSMValidator#validate
     */
    public static <I> FSM<I> create(Alphabet<I> alphabet,
                                    int numberOfStates,
                                    Collection<Integer> acceptedStates,
                                    int startState,
                                    Collection<TransitionTriple<I>> transitions) {
        final Collection<Integer> accepted = acceptedStates == null ? List.of() : acceptedStates;
        final Collection<TransitionTriple<I>> triples = transitions == null ? List.of() : transitions;
        FSMValidator.validate(alphabet, numberOfStates, accepted, startState, triples);

        // everything is valid, we can safely create the object
        final boolean[] accepting = new boolean[numberOfStates];
        for (int id : accepted) {
            accepting[id] = true;
        }
        final List<State> states = new ArrayList<>(numberOfStates);
        for (int id = 0; id < numberOfStates; id++) {
            states.add(new State(id, accepting[id]));
        }
        final State start = numberOfStates == 0 ? null : states.get(startState);

        final List<Transition<I>> resolved = new ArrayList<>(triples.size());
        for (TransitionTriple<I> t : triples) {
            resolved.add(new Transition<>(states.get(t.from()), states.get(t.to()), t.symbol()));
        }

        return new FSM<>(alphabet, FSMSnapshot.of(alphabet, states, start, resolved));
    }

    /**
     * Turns this machine into a deterministic one, if it isn't already. The result is not necessarily minimal.
     * <p>
     * Missing transitions are routed into a sink state first; remaining duplicate transitions are then resolved
     * by powerset construction.
     * @throws IllegalStateException if the alphabet is empty
     */
    public void makeDeterministic() {
        makeDeterministic(new Cancellation());
    }

    /**
     * @param cancellation - bounds the powerset construction; the machine is unchanged if it trips
     * @throws IllegalStateException if the alphabet is empty or the construction was cancelled
     */
    public void makeDeterministic(Cancellation cancellation) {
        if (getType() == FSMType.DETERMINISTIC) {
            return;
        }
        if (alphabet.isEmpty()) {
            throw new IllegalStateException("A machine over the empty alphabet cannot be made deterministic");
        }

        FSMSnapshot<I> result = TransitionCompletion.complete(alphabet, structure);
        if (DeterminismClassifier.isOverdefined(result.size(), alphabet, result.transitions())) {
            result = new PowersetDeterminizer(cancellation).determinize(alphabet, result);
        }
        if (result.type() != FSMType.DETERMINISTIC) {
            throw new IllegalStateException("Determinization produced a non-deterministic machine");
        }
        structure = result;
        minimized = false;
    }

    /**
     * Minimizes this machine if it is not already minimal. Only works on deterministic machines.
     * @throws IllegalStateException if this machine is not deterministic
     */
    public void minimize() {
        if (getType() != FSMType.DETERMINISTIC) {
            throw new IllegalStateException("minimization requires a deterministic machine");
        }
        if (minimized) {
            return;
        }
        structure = MooreMinimizer.minimize(alphabet, structure);
        minimized = true;
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public List<State> getStates() {
        return structure.states();
    }

    public List<State> getAcceptedStates() {
        return structure.acceptedStates();
    }

    /**
     * @return the start state, or null if this machine has no states
     */
    public State getStartingState() {
        return structure.startingState();
    }

    public List<Transition<I>> getTransitions() {
        return structure.transitions();
    }

    public FSMType getType() {
        return structure.type();
    }

    public boolean isDeterministic() {
        return getType() == FSMType.DETERMINISTIC;
    }

    /**
     * @return the current structure as one consistent value
     */
    public FSMSnapshot<I> snapshot() {
        return structure;
    }

    public int size() {
        return structure.size();
    }

    @Override
    public String toString() {
        return "FSM{type=" + getType() + ", alphabet=" + alphabet + ", states=" + getStates()
                + ", start=" + getStartingState() + ", transitions=" + getTransitions() + "}";
    }
}
