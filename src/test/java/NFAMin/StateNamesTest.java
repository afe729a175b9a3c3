package NFAMin;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StateNamesTest {
  @Test
  void testConfigurationNames() {
    Assertions.assertEquals("", StateNames.ofConfiguration(List.of()));
    Assertions.assertEquals("1", StateNames.ofConfiguration(List.of("1")));
    Assertions.assertEquals("1 + 2 + 3", StateNames.ofConfiguration(List.of("3", "1", "2")));
    Assertions.assertEquals(StateNames.ofConfiguration(List.of("b", "a")), StateNames.ofConfiguration(Set.of("a", "b")));
  }

  @Test
  void testEquivalenceClassNames() {
    Assertions.assertEquals("1 + 2", StateNames.ofEquivalenceClass(List.of("1 + 2")));
    Assertions.assertEquals("1 + 2 | 1 + 3", StateNames.ofEquivalenceClass(List.of("1 + 3", "1 + 2")));
    Assertions.assertEquals("", StateNames.ofEquivalenceClass(List.of("")));
    Assertions.assertEquals("\\e | x", StateNames.ofEquivalenceClass(List.of("x", "")));
  }

  @Test
  void testUnmergedNamesAreKept() {
    Assertions.assertEquals("a\\b", StateNames.ofEquivalenceClass(List.of("a\\b")));
    Assertions.assertEquals("x \\+ y", StateNames.ofEquivalenceClass(List.of("x \\+ y")));
    Assertions.assertEquals("p \\| q", StateNames.ofEquivalenceClass(List.of("p | q")));
    Assertions.assertNotEquals(StateNames.ofEquivalenceClass(List.of("p | q")),
        StateNames.ofEquivalenceClass(List.of("p", "q")));
  }

  @Test
  void testEscaping() {
    Assertions.assertEquals("x \\+ y", StateNames.ofConfiguration(List.of("x + y")));
    Assertions.assertNotEquals(StateNames.ofConfiguration(List.of("x + y")), StateNames.ofConfiguration(List.of("x", "y")));
    Assertions.assertEquals("\\e", StateNames.ofConfiguration(List.of("")));
    Assertions.assertNotEquals(StateNames.ofConfiguration(List.of("")), StateNames.ofConfiguration(List.of()));
    Assertions.assertEquals("a\\\\", StateNames.escape("a\\", '+'));
    Assertions.assertEquals("a|b", StateNames.escape("a|b", '+'));
    Assertions.assertEquals("a\\|b", StateNames.escape("a|b", '|'));
    Assertions.assertNotEquals(StateNames.ofEquivalenceClass(List.of("p | q")),
        StateNames.ofEquivalenceClass(List.of("p", "q")));
  }
}
