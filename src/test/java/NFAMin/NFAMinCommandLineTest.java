package NFAMin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import NFAMin.Model.RawDfa;
import NFAMin.Model.RawNfa;
import NFAMin.Model.StateLimit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertThrows;

class NFAMinCommandLineTest {
  private static final List<String> ALL_MODES = List.of("convert", "determinize");

  @Test
  void testTrivialAutomata() throws Exception {
    for (String mode : ALL_MODES) {
      // all-accepting NFA
      RawNfa nfa = new RawNfa("0", Set.of("a"), Set.of("0"), Map.of("0", Map.of("a", Set.of("0"))));
      Dfa dfa = "convert".equals(mode) ? NFAMinCommandLine.convert(nfa, true) : NFAMinCommandLine.determinize(nfa, true);
      Assertions.assertEquals(1, dfa.size());

      // non-total NFA
      nfa = new RawNfa("0", Set.of("a"), Set.of("0"), Map.of("0", Map.of()));
      dfa = "convert".equals(mode) ? NFAMinCommandLine.convert(nfa, true) : NFAMinCommandLine.determinize(nfa, true);
      Assertions.assertEquals(2, dfa.size());
    }
  }

  @Test
  void testMinimizeMode() throws Exception {
    RawDfa raw = new RawDfa("1", Set.of("a", "b"), Set.of("2", "4"), Map.of(
        "1", Map.of("a", "2", "b", "3"),
        "2", Map.of(),
        "3", Map.of("a", "4", "b", "1"),
        "4", Map.of()));
    Dfa minimal = NFAMinCommandLine.minimize(raw, true);
    Assertions.assertEquals(2, minimal.size());
  }

  @Test
  void testRunModeFromFiles(@TempDir Path dir) throws Exception {
    Path nfaFile = dir.resolve("nfa.json");
    Files.writeString(nfaFile, AutomatonValidatorTest.VALID_NFA);

    Dfa dfa = NFAMinCommandLine.runMode("determinize", nfaFile.toString(), new StateLimit(), false);
    Assertions.assertEquals(4, dfa.size());

    Path dfaFile = dir.resolve("dfa.json");
    JsonFormat.writeFile(dfaFile.toFile(), dfa);
    Dfa minimal = NFAMinCommandLine.runMode("minimize", dfaFile.toString(), new StateLimit(), true);
    Assertions.assertEquals(4, minimal.size());

    assertThrows(IOException.class,
        () -> NFAMinCommandLine.runMode("convert", nfaFile.toString(), new StateLimit(2), false));
    assertThrows(IllegalStateException.class,
        () -> NFAMinCommandLine.runMode("bogus", nfaFile.toString(), new StateLimit(), false));
  }

  @Test
  void testModeChoices() {
    Assertions.assertEquals(Set.of("convert", "determinize", "minimize", "serve"), NFAMinCommandLine.MODES);
    Assertions.assertFalse(NFAMinCommandLine.MODES.contains("bogus"));
    assertThrows(IllegalStateException.class,
        () -> NFAMinCommandLine.runMode("bogus", "unused.json", new StateLimit(), false));
  }

  @Test
  void testInvalidInput() {
    RawNfa nfa = new RawNfa("0", Set.of("a"), Set.of("1"), Map.of("0", Map.of()));
    assertThrows(UnknownStateException.class, () -> NFAMinCommandLine.convert(nfa, false));
  }

  @Test
  void testBAInput() throws Exception {
    Path filePath = Path.of(getClass().getClassLoader().getResource("ends_in_ab.ba").toURI());
    Dfa dfa = NFAMinCommandLine.runMode("convert", filePath.toString(), new StateLimit(), true);
    Assertions.assertEquals(3, dfa.size());
  }
}
