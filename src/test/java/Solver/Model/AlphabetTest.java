package Solver.Model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class AlphabetTest {
  @Test
  void testEmpty() {
    Alphabet<Character> alphabet = Alphabet.create(new ArrayList<>());
    Assertions.assertNotNull(alphabet);
    Assertions.assertEquals(0, alphabet.size());
    Assertions.assertTrue(alphabet.isEmpty());
    Assertions.assertSame(Alphabet.empty(), alphabet);
  }

  @Test
  void testFromNull() {
    Alphabet<Character> alphabet = Alphabet.create(null);
    Assertions.assertNotNull(alphabet);
    Assertions.assertEquals(0, alphabet.size());
    Assertions.assertSame(Alphabet.empty(), alphabet);
    Assertions.assertSame(Alphabet.empty(), Alphabet.of());
  }

  @Test
  void testGeneralCase() {
    Alphabet<Character> alphabet = Alphabet.create(List.of('0', '1'));
    Assertions.assertEquals(List.of('0', '1'), alphabet.getSymbols());
    Assertions.assertEquals(2, alphabet.size());
    Assertions.assertEquals(Character.valueOf('1'), alphabet.getSymbol(1));
  }

  @Test
  void testDuplicatedSymbols() {
    Alphabet<Character> alphabet = Alphabet.of('b', 'a', 'b', 'c', 'a');
    // first occurrence wins
    Assertions.assertEquals(List.of('b', 'a', 'c'), alphabet.getSymbols());
    Assertions.assertEquals(0, alphabet.indexOf('b'));
    Assertions.assertEquals(1, alphabet.indexOf('a'));
    Assertions.assertEquals(2, alphabet.indexOf('c'));
  }

  @Test
  void testContains() {
    Alphabet<Character> alphabet = Alphabet.of('0', '1');
    for (char symbol : new char[]{'0', '1'}) {
      Assertions.assertTrue(alphabet.contains(symbol));
    }
    Assertions.assertFalse(alphabet.contains('2'));
    Assertions.assertEquals(Alphabet.MISSING_SYMBOL, alphabet.indexOf('2'));
  }

  @Test
  void testImmutable() {
    List<String> symbols = new ArrayList<>(List.of("x", "y"));
    Alphabet<String> alphabet = Alphabet.create(symbols);
    symbols.add("z");
    Assertions.assertEquals(2, alphabet.size());
    assertThrows(UnsupportedOperationException.class, () -> alphabet.getSymbols().add("z"));
  }

  @Test
  void testNullSymbol() {
    List<Character> symbols = new ArrayList<>();
    symbols.add('a');
    symbols.add(null);
    assertThrows(NullPointerException.class, () -> Alphabet.create(symbols));
  }

  @Test
  void testIterationOrder() {
    Alphabet<Integer> alphabet = Alphabet.of(3, 1, 2);
    List<Integer> seen = new ArrayList<>();
    for (int i : alphabet) {
      seen.add(i);
    }
    Assertions.assertEquals(List.of(3, 1, 2), seen);
    Assertions.assertEquals("[3, 1, 2]", alphabet.toString());
  }
}
