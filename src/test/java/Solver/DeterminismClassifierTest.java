package Solver;

import Solver.Model.Alphabet;
import Solver.Model.FSMType;
import Solver.Model.State;
import Solver.Model.Transition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static Solver.FSMExamples.AB;

class DeterminismClassifierTest {
  private static final State S0 = new State(0, false);
  private static final State S1 = new State(1, true);

  @Test
  void testComplete() {
    List<Transition<Character>> transitions = List.of(
        new Transition<>(S0, S1, 'a'),
        new Transition<>(S0, S0, 'b'),
        new Transition<>(S1, S1, 'b'),
        new Transition<>(S1, S0, 'a'));
    Assertions.assertEquals(FSMType.DETERMINISTIC, DeterminismClassifier.classify(2, AB, transitions));
    Assertions.assertFalse(DeterminismClassifier.isUnderdefined(2, AB, transitions));
    Assertions.assertFalse(DeterminismClassifier.isOverdefined(2, AB, transitions));
  }

  @Test
  void testMissingPair() {
    List<Transition<Character>> transitions = List.of(
        new Transition<>(S0, S1, 'a'),
        new Transition<>(S0, S0, 'b'),
        new Transition<>(S1, S1, 'b'));
    Assertions.assertEquals(FSMType.NON_DETERMINISTIC, DeterminismClassifier.classify(2, AB, transitions));
    Assertions.assertTrue(DeterminismClassifier.isUnderdefined(2, AB, transitions));
    Assertions.assertFalse(DeterminismClassifier.isOverdefined(2, AB, transitions));
  }

  @Test
  void testDuplicatedPairWithRightCount() {
    // four transitions for two states and two symbols, but (1,b) twice and (1,a) never
    List<Transition<Character>> transitions = List.of(
        new Transition<>(S0, S1, 'a'),
        new Transition<>(S0, S0, 'b'),
        new Transition<>(S1, S1, 'b'),
        new Transition<>(S1, S0, 'b'));
    Assertions.assertEquals(FSMType.NON_DETERMINISTIC, DeterminismClassifier.classify(2, AB, transitions));
    Assertions.assertTrue(DeterminismClassifier.isUnderdefined(2, AB, transitions));
    Assertions.assertTrue(DeterminismClassifier.isOverdefined(2, AB, transitions));
  }

  @Test
  void testVacuousMachines() {
    Assertions.assertEquals(FSMType.NON_DETERMINISTIC, DeterminismClassifier.classify(0, AB, List.of()));
    Assertions.assertEquals(FSMType.NON_DETERMINISTIC, DeterminismClassifier.classify(2, AB, List.of()));
    // no symbols: every state trivially has one transition per symbol, still not deterministic
    Assertions.assertEquals(FSMType.NON_DETERMINISTIC,
        DeterminismClassifier.classify(1, Alphabet.<Character>empty(), List.of()));
  }

  @Test
  void testCountTable() {
    List<Transition<Character>> transitions = List.of(
        new Transition<>(S0, S1, 'a'),
        new Transition<>(S0, S0, 'a'),
        new Transition<>(S1, S1, 'b'));
    Assertions.assertArrayEquals(new int[]{2, 0, 0, 1}, DeterminismClassifier.countTransitions(2, AB, transitions));
  }
}
