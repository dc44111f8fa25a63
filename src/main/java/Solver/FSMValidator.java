package Solver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import Solver.Model.Alphabet;
import Solver.Model.InvalidTransitionsException;
import Solver.Model.OutOfRangeException;
import Solver.Model.TransitionTriple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks of a raw FSM description. The first violated check throws.
 */
public class FSMValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(FSMValidator.class);

    private FSMValidator() {}

    /**
     * @param alphabet - must not be null
     * @param numberOfStates - zero or more
     * @param acceptedStates - at most numberOfStates ids in [0, numberOfStates)
     * @param startState - in [0, numberOfStates), ignored if there are no states
     * @param transitions - endpoints in [0, numberOfStates), symbols from the alphabet
     * @throws NullPointerException if the alphabet is missing
     * @throws OutOfRangeException if the state count is negative or the start state is out of range
     * @throws InvalidTransitionsException if any transition is invalid; all of them are logged first
     * @throws IllegalArgumentException if the accepted states are too many or out of range
     */
    public static <I> void validate(Alphabet<I> alphabet,
                                    int numberOfStates,
                                    Collection<Integer> acceptedStates,
                                    int startState,
                                    Collection<TransitionTriple<I>> transitions) {
        Objects.requireNonNull(alphabet, "alphabet");
        Objects.requireNonNull(acceptedStates, "acceptedStates");
        Objects.requireNonNull(transitions, "transitions");

        if (numberOfStates < 0) {
            throw new OutOfRangeException("numberOfStates", numberOfStates, "must not be negative");
        }
        if (numberOfStates > 0 && !inRange(startState, numberOfStates)) {
            throw new OutOfRangeException("startState", startState, "must be in [0;" + numberOfStates + ")");
        }

        if (acceptedStates.size() > numberOfStates) {
            throw new IllegalArgumentException("acceptedStates contains more states than the state count: "
                    + acceptedStates.size() + " > " + numberOfStates);
        }
        for (Integer accepted : acceptedStates) {
            if (accepted == null || !inRange(accepted, numberOfStates)) {
                throw new IllegalArgumentException("acceptedStates contains out of range state: " + accepted);
            }
        }

        final List<TransitionTriple<I>> invalid = new ArrayList<>();
        for (TransitionTriple<I> t : transitions) {
            Objects.requireNonNull(t, "transition");
            if (!inRange(t.from(), numberOfStates) || !inRange(t.to(), numberOfStates)
                    || t.symbol() == null || !alphabet.contains(t.symbol())) {
                invalid.add(t);
            }
        }
        if (!invalid.isEmpty()) {
            LOGGER.error("Invalid transitions:");
            for (TransitionTriple<I> t : invalid) {
                LOGGER.error("{}", t);
            }
            throw new InvalidTransitionsException(invalid);
        }
    }

    private static boolean inRange(int id, int numberOfStates) {
        return id >= 0 && id < numberOfStates;
    }
}
