package Solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import Solver.Model.State;
import Solver.Model.Transition;
import Solver.Model.TransitionTriple;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.concept.StateIDs;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversions between {@link FSM} and AutomataLib automata, e.g., for equivalence checks or rendering.
 * Symbol order and state ids are preserved in both directions.
 */
public class AutomataConversions {
    private AutomataConversions() {}

    public static <I> Alphabet<I> toAlphabet(Solver.Model.Alphabet<I> alphabet) {
        return Alphabets.fromCollection(alphabet.getSymbols());
    }

    /**
     * Copy a machine into a {@link CompactNFA}. The start state (if any) becomes the only initial state.
     */
    public static <I> CompactNFA<I> toNFA(FSM<I> fsm) {
        final CompactNFA<I> nfa = new CompactNFA<>(toAlphabet(fsm.getAlphabet()), fsm.size());
        for (State s : fsm.getStates()) {
            nfa.addState(s.accepting());
        }
        final State start = fsm.getStartingState();
        if (start != null) {
            nfa.setInitial(start.id(), true);
        }
        for (Transition<I> t : fsm.getTransitions()) {
            nfa.addTransition(t.start().id(), t.symbol(), t.end().id());
        }
        return nfa;
    }

    /**
     * Copy a deterministic machine into a {@link CompactDFA}.
     * @throws IllegalStateException if the machine is not deterministic
     */
    public static <I> CompactDFA<I> toDFA(FSM<I> fsm) {
        if (!fsm.isDeterministic()) {
            throw new IllegalStateException("Only deterministic machines can be converted to a DFA");
        }
        final Solver.Model.Alphabet<I> symbols = fsm.getAlphabet();
        final CompactDFA<I> dfa = new CompactDFA<>(toAlphabet(symbols), fsm.size());
        for (State s : fsm.getStates()) {
            dfa.addState(s.accepting());
        }
        dfa.setInitial(fsm.getStartingState().id(), true);
        for (Transition<I> t : fsm.getTransitions()) {
            dfa.setTransition(t.start().id(), symbols.indexOf(t.symbol()), t.end().id());
        }
        return dfa;
    }

    /**
     * Build a machine from an AutomataLib NFA with exactly one initial state (or no states at all).
     * @param nfa - source automaton
     * @param inputs - symbols to copy transitions for, in this order
     * @return validated machine
     * @throws IllegalArgumentException if the automaton does not have exactly one initial state
     */
    public static <S, I> FSM<I> fromNFA(NFA<S, I> nfa, Alphabet<I> inputs) {
        final int numStates = nfa.size();
        final Set<S> inits = nfa.getInitialStates();
        if (numStates > 0 && inits.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one initial state, found " + inits.size());
        }

        final StateIDs<S> stateIDs = nfa.stateIDs();
        final List<Integer> accepted = new ArrayList<>();
        final List<TransitionTriple<I>> transitions = new ArrayList<>();
        for (S s : nfa.getStates()) {
            final int id = stateIDs.getStateId(s);
            if (nfa.isAccepting(s)) {
                accepted.add(id);
            }
            for (I i : inputs) {
                for (S t : nfa.getTransitions(s, i)) {
                    transitions.add(TransitionTriple.of(id, stateIDs.getStateId(t), i));
                }
            }
        }
        final int start = numStates == 0 ? 0 : stateIDs.getStateId(inits.iterator().next());
        return FSM.create(Solver.Model.Alphabet.create(inputs), numStates, accepted, start, transitions);
    }
}
