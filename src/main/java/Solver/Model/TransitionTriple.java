package Solver.Model;

/**
 * Unvalidated transition as supplied by a caller: (from, to, symbol).
 * @param <I> - Input symbol type
 */
public record TransitionTriple<I>(int from, int to, I symbol) {

  public static <I> TransitionTriple<I> of(int from, int to, I symbol) {
    return new TransitionTriple<>(from, to, symbol);
  }

  @Override
  public String toString() {
    return "[" + from + ";" + to + ";" + symbol + "]";
  }
}
