package Solver.Model;

/**
 * Labeled edge between two states of the same FSM.
 * @param <I> - Input symbol type
 */
public record Transition<I>(State start, State end, I symbol) {

  @Override
  public String toString() {
    return start.id() + " -" + symbol + "-> " + end.id();
  }
}
