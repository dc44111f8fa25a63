package Solver.Model;

import java.util.List;

/**
 * Thrown when transitions reference unknown states or symbols. All offending transitions are reported, not just
 * the first one.
 */
public class InvalidTransitionsException extends IllegalArgumentException {

    private final transient List<TransitionTriple<?>> invalidTransitions;

    public InvalidTransitionsException(List<? extends TransitionTriple<?>> invalidTransitions) {
        super("Invalid transitions: " + invalidTransitions);
        this.invalidTransitions = List.copyOf(invalidTransitions);
    }

    public List<TransitionTriple<?>> getInvalidTransitions() {
        return invalidTransitions;
    }
}
