package Solver.Model;

/**
 * State of a FSM, identified by its dense id. State {@code i} is at position {@code i} of its machine's state list.
 */
public record State(int id, boolean accepting) {

  @Override
  public String toString() {
    return accepting ? "(" + id + ")" : String.valueOf(id);
  }
}
