package NFAMin.Registry;

import java.util.BitSet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class AddressRegistryTest {
  private static BitSet bits(int... indices) {
    BitSet b = new BitSet();
    for (int i : indices) {
      b.set(i);
    }
    return b;
  }

  @Test
  void testAddressRegistry() {
    AddressRegistry addressRegistry = new AddressRegistry();
    Assertions.assertNull(addressRegistry.get(new BitSet()));
    Assertions.assertFalse(addressRegistry.contains(new BitSet()));

    addressRegistry.put(bits(1, 2, 3), "1 + 2 + 3");
    Assertions.assertEquals("1 + 2 + 3", addressRegistry.get(bits(1, 2, 3)));
    addressRegistry.put(new BitSet(), "");
    Assertions.assertEquals("", addressRegistry.get(new BitSet()));
    Assertions.assertTrue(addressRegistry.contains(new BitSet()));
    Assertions.assertEquals(2, addressRegistry.size());
    Assertions.assertEquals("Address(2)", addressRegistry.toString());
  }

  @Test
  void testKeysAreCopied() {
    AddressRegistry addressRegistry = new AddressRegistry();
    BitSet b = bits(0);
    addressRegistry.put(b, "0");
    b.set(1); // mutating the caller's BitSet must not affect the registry
    Assertions.assertEquals("0", addressRegistry.get(bits(0)));
    Assertions.assertNull(addressRegistry.get(bits(0, 1)));
  }

  @Test
  void testCollisions() {
    AddressRegistry addressRegistry = new AddressRegistry();
    addressRegistry.put(bits(0), "x");
    assertThrows(IllegalStateException.class, () -> addressRegistry.put(bits(0), "y"));
    assertThrows(IllegalStateException.class, () -> addressRegistry.put(bits(1), "x"));
    Assertions.assertEquals(1, addressRegistry.size());
  }
}
