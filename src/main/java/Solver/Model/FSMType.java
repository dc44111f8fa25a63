package Solver.Model;

public enum FSMType {
    /**
     * Exactly one transition per state for each symbol of the alphabet.
     */
    DETERMINISTIC,
    /**
     * Some state has zero or more than one transitions for a symbol. Also used for machines without states or
     * transitions.
     */
    NON_DETERMINISTIC
}
