package Solver;

import java.util.List;

import Solver.Model.Alphabet;
import Solver.Model.FSMType;
import Solver.Model.Transition;

/**
 * Decides whether a transition set is deterministic, i.e., whether every state has exactly one transition per
 * symbol. Transitions are counted per (state, symbol) pair, so the cost is linear in states * symbols + transitions.
 */
public class DeterminismClassifier {
    private DeterminismClassifier() {}

    /**
     * @param numStates - number of (dense) states
     * @param alphabet - alphabet; its symbol order indexes the count table
     * @param transitions - validated transitions
     * @return DETERMINISTIC iff every (state, symbol) pair has exactly one transition.
     *         Machines without states or without transitions are NON_DETERMINISTIC.
     */
    public static <I> FSMType classify(int numStates, Alphabet<I> alphabet, List<Transition<I>> transitions) {
        if (numStates == 0 || transitions.isEmpty()) {
            return FSMType.NON_DETERMINISTIC;
        }
        if (transitions.size() != numStates * alphabet.size()) {
            return FSMType.NON_DETERMINISTIC;
        }
        for (int count : countTransitions(numStates, alphabet, transitions)) {
            if (count != 1) {
                return FSMType.NON_DETERMINISTIC;
            }
        }
        return FSMType.DETERMINISTIC;
    }

    /**
     * @return whether some (state, symbol) pair has no transition
     */
    public static <I> boolean isUnderdefined(int numStates, Alphabet<I> alphabet, List<Transition<I>> transitions) {
        for (int count : countTransitions(numStates, alphabet, transitions)) {
            if (count == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return whether some (state, symbol) pair has two or more transitions
     */
    public static <I> boolean isOverdefined(int numStates, Alphabet<I> alphabet, List<Transition<I>> transitions) {
        for (int count : countTransitions(numStates, alphabet, transitions)) {
            if (count > 1) {
                return true;
            }
        }
        return false;
    }

    /**
     * Count table: entry {@code state * alphabet.size() + symbolIndex} holds the number of transitions leaving
     * state on that symbol.
     */
    static <I> int[] countTransitions(int numStates, Alphabet<I> alphabet, List<Transition<I>> transitions) {
        final int numInputs = alphabet.size();
        final int[] counts = new int[numStates * numInputs];
        for (Transition<I> t : transitions) {
            counts[t.start().id() * numInputs + alphabet.indexOf(t.symbol())]++;
        }
        return counts;
    }
}
