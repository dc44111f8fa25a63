package Solver.Model;

import java.util.BitSet;

/**
 * Work item of the powerset construction: a subset of original states and the id of its powerset state.
 */
public record DeterminizeRecord(BitSet inputState, int outputAddress) {

  @Override
  public String toString() {
    return outputAddress + ": " + inputState;
  }
}
