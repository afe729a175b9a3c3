package NFAMin;

import java.util.List;
import java.util.Map;
import java.util.Set;

import NFAMin.Model.RawNfa;
import NFAMin.Registry.AddressRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class SubsetDeterminizerTest {
  @Test
  void testBasicConversion() throws Exception {
    VerifiedNfa nfa = AutomatonValidator.validate(JsonFormat.readNfa(AutomatonValidatorTest.VALID_NFA));
    Dfa dfa = SubsetDeterminizer.determinize(nfa);

    Assertions.assertEquals("1", dfa.getStart());
    Assertions.assertEquals(Set.of("1", "1 + 2", "1 + 2 + 3", "1 + 3"), dfa.getStates());
    Assertions.assertEquals(Set.of("1 + 2 + 3", "1 + 3"), dfa.getFinalStates());
    Assertions.assertEquals(Set.of("a", "b"), dfa.getAlphabet());
    Assertions.assertEquals(Map.of("a", "1 + 2", "b", "1"), dfa.getNodes().get("1"));
    Assertions.assertEquals(Map.of("a", "1 + 2 + 3", "b", "1 + 3"), dfa.getNodes().get("1 + 2"));
    Assertions.assertEquals(Map.of("a", "1 + 2 + 3", "b", "1 + 2 + 3"), dfa.getNodes().get("1 + 2 + 3"));
    Assertions.assertEquals(Map.of("a", "1 + 2", "b", "1 + 2"), dfa.getNodes().get("1 + 3"));
    Assertions.assertTrue(dfa.isComplete());
  }

  @Test
  void testFinalStateWithoutTransitions() throws Exception {
    RawNfa raw = JsonFormat.readNfa("""
        {
          "start": "1",
          "alphabet": ["a", "b"],
          "nodes": {
            "1": {"a": ["1", "2"], "b": ["1"]},
            "2": {"a": ["3"], "b": ["3"]},
            "3": {}
          },
          "final_states": ["3"]
        }""");
    Dfa dfa = SubsetDeterminizer.determinize(AutomatonValidator.validate(raw));

    Assertions.assertEquals(Set.of("1 + 2 + 3", "1 + 3"), dfa.getFinalStates());
    Assertions.assertEquals(Map.of("a", "1 + 2", "b", "1"), dfa.getNodes().get("1"));
    Assertions.assertEquals(Map.of("a", "1 + 2 + 3", "b", "1 + 3"), dfa.getNodes().get("1 + 2"));
    Assertions.assertEquals(Map.of("a", "1 + 2 + 3", "b", "1 + 3"), dfa.getNodes().get("1 + 2 + 3"));
    Assertions.assertEquals(Map.of("a", "1 + 2", "b", "1"), dfa.getNodes().get("1 + 3"));
    Assertions.assertEquals(4, dfa.size());
  }

  @Test
  void testDeadConfiguration() throws Exception {
    RawNfa raw = new RawNfa("s", Set.of("a", "b"), Set.of("t"),
        Map.of("s", Map.of("a", Set.of("t")), "t", Map.of()));
    Dfa dfa = SubsetDeterminizer.determinize(AutomatonValidator.validate(raw));

    Assertions.assertEquals(3, dfa.size());
    Assertions.assertEquals("", dfa.getTransition("s", "b"));
    Assertions.assertEquals(Map.of("a", "", "b", ""), dfa.getNodes().get(""));
    Assertions.assertFalse(dfa.isAccepting(""));
    Assertions.assertTrue(dfa.isComplete());
    Assertions.assertTrue(dfa.accepts(List.of("a")));
    Assertions.assertFalse(dfa.accepts(List.of("a", "a")));
  }

  @Test
  void testEmptyAlphabet() throws Exception {
    RawNfa raw = new RawNfa("s", Set.of(), Set.of("s"), Map.of("s", Map.of()));
    Dfa dfa = SubsetDeterminizer.determinize(AutomatonValidator.validate(raw));
    Assertions.assertEquals(1, dfa.size());
    Assertions.assertTrue(dfa.accepts(List.of()));
  }

  @Test
  void testSeparatorInStateIds() throws Exception {
    // without escaping, {"x + y"} and {"x", "y"} would both be named "x + y"
    RawNfa raw = new RawNfa("s", Set.of("a", "b"), Set.of("x + y"),
        Map.of("s", Map.of("a", Set.of("x + y"), "b", Set.of("x", "y")),
            "x + y", Map.of(),
            "x", Map.of(),
            "y", Map.of()));
    Dfa dfa = SubsetDeterminizer.determinize(AutomatonValidator.validate(raw));

    Assertions.assertEquals(4, dfa.size()); // s, {x + y}, {x, y}, dead
    Assertions.assertNotEquals(dfa.getTransition("s", "a"), dfa.getTransition("s", "b"));
    Assertions.assertTrue(dfa.accepts(List.of("a")));
    Assertions.assertFalse(dfa.accepts(List.of("b")));
  }

  @Test
  void testRegistryRejectsReuse() throws Exception {
    VerifiedNfa nfa = AutomatonValidator.validate(JsonFormat.readNfa(AutomatonValidatorTest.VALID_NFA));
    AddressRegistry registry = new AddressRegistry();
    SubsetDeterminizer.determinize(nfa, registry);
    Assertions.assertEquals(4, registry.size());
    // the registry already knows the start configuration
    assertThrows(IllegalStateException.class, () -> SubsetDeterminizer.determinize(nfa, registry));
  }

  @Test
  void testLanguageEquivalence() throws Exception {
    for (int seed = 0; seed < 50; seed++) {
      VerifiedNfa nfa = AutomatonValidator.validate(TabakovVardiRandomNFA.getRandomAutomaton(seed, 6));
      Dfa dfa = SubsetDeterminizer.determinize(nfa);
      Assertions.assertTrue(dfa.isComplete());
      Assertions.assertEquals("q0", dfa.getStart());
      for (List<String> word : Words.upTo(nfa.getAlphabet(), 7)) {
        Assertions.assertEquals(nfa.accepts(word), dfa.accepts(word), "seed " + seed + ", word " + word);
      }
    }
  }
}
