package Solver.Registry;

import Solver.BitSetTestUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class RegistryTest {
  @Test
  void testAddressRegistry() {
    AddressRegistry addressRegistry = new AddressRegistry();
    Assertions.assertEquals(Registry.MISSING_ELEMENT, addressRegistry.get(new BitSet()));
    Assertions.assertEquals(0, addressRegistry.size());

    BitSet b = BitSetTestUtils.convertListToBitSet(List.of(1, 2, 3));
    addressRegistry.put(b, 1);
    Assertions.assertEquals(1, addressRegistry.get(b));
    // lookup is by content, not identity
    Assertions.assertEquals(1, addressRegistry.get(BitSetTestUtils.convertListToBitSet(List.of(3, 2, 1))));

    b = BitSetTestUtils.convertListToBitSet(List.of(1));
    addressRegistry.put(b, 0);
    Assertions.assertEquals(0, addressRegistry.get(b));
    Assertions.assertEquals(2, addressRegistry.size());

    Assertions.assertEquals(b, addressRegistry.getSubset(0));
    Assertions.assertEquals(BitSetTestUtils.convertListToBitSet(List.of(1, 2, 3)), addressRegistry.getSubset(1));
    Assertions.assertNull(addressRegistry.getSubset(2));
    Assertions.assertNull(addressRegistry.getSubset(-1));

    Assertions.assertEquals("Address", addressRegistry.toString());
    assertThrows(IllegalArgumentException.class, () -> addressRegistry.put(new BitSet(), -1));
  }
}
