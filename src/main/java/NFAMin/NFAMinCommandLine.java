package NFAMin;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import NFAMin.Model.RawDfa;
import NFAMin.Model.RawNfa;
import NFAMin.Model.StateLimit;
import NFAMin.Service.ConversionServer;
import NFAMin.Service.ConversionService;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

public class NFAMinCommandLine {
  static final Set<String> MODES = Set.of("convert", "determinize", "minimize", "serve");

  public static void main(String[] args) {
    String filename = null;
    boolean verify = false;
    StateLimit stateLimit = new StateLimit();
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        SubsetDeterminizer.DEBUG = true;
        TableFillingMinimizer.DEBUG = true;
      } else if ("--verify".equalsIgnoreCase(arg)) {
        verify = true;
      } else if ("--out".equalsIgnoreCase(arg) || "--maxStates".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for " + arg);
          printUsageAndExit(2); // exits
        }
        String value = args[++i]; // consume the value
        if ("--out".equalsIgnoreCase(arg)) {
          filename = value;
        } else {
          stateLimit = parseLimit(value);
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit(2);
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 2) {
      printUsageAndExit(2);
    }

    String mode = positional.get(0).toLowerCase();
    String input = positional.get(1);
    if (!MODES.contains(mode)) {
      System.err.println("Unknown mode: " + mode);
      printUsageAndExit(2);
    }

    if ("serve".equals(mode)) {
      serve(input, stateLimit);
      return;
    }

    try {
      long before = System.currentTimeMillis();
      Dfa result = runMode(mode, input, stateLimit, verify);
      long after = System.currentTimeMillis();
      System.out.println(mode + " result size: " + result.size());
      System.out.println(mode + " duration: " + ((after - before) / 1000f) + "s");

      if (filename != null) {
        System.out.println("Writing to file: " + filename);
        JsonFormat.writeFile(new File(filename), result);
      } else {
        System.out.println(JsonFormat.write(result));
      }
    } catch (ValidationException e) {
      System.err.println("Invalid automaton: " + e.getMessage());
      System.exit(1);
    } catch (FormatException e) {
      System.err.println("Could not parse " + input + ": " + e.getMessage());
      System.exit(1);
    } catch (IOException e) {
      System.err.println("Could not read " + input + ": " + e.getMessage());
      System.exit(1);
    }
  }

  private static void printUsageAndExit(int status) {
    System.out.println(
        "NFAMin [--debug] [--verify] [--maxStates <n>] [--out <JSON output file>] <mode> <input>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--verify] : Cross-check the result against AutomataLib");
    System.out.println("[--maxStates <n>] : Refuse NFAs with more than n states (default "
        + StateLimit.DEFAULT_MAX_STATES + ")");
    System.out.println("[--out <JSON output file>] : Write DFA to specified output file instead of stdout");
    System.out.println();
    System.out.println("<mode> : one of the choices below:");
    System.out.println("  convert: NFA to minimal DFA.");
    System.out.println("  determinize: NFA to DFA by subset construction, without minimization.");
    System.out.println("  minimize: DFA to minimal DFA.");
    System.out.println("  serve: HTTP service; <input> is the port. POST NFAs to " + ConversionServer.PATH);
    System.out.println();
    System.out.println("<input> : automaton as JSON, or an NFA in the BA format if the name ends in .ba");
    System.out.println("  BA format described here: https://languageinclusion.org/doku.php?id=tools");
    System.exit(status);
  }

  private static StateLimit parseLimit(String value) {
    try {
      return new StateLimit(Integer.parseInt(value));
    } catch (IllegalArgumentException e) {
      System.err.println("Invalid value for --maxStates: " + value);
      printUsageAndExit(2);
      return null; // unreachable
    }
  }

  /**
   * Choose pipeline to run.
   * @param mode - mode passed in from command-line
   * @param input - input file path
   * @param stateLimit - cap on NFA input size
   * @param verify - whether to cross-check with AutomataLib
   * @return - resulting DFA
   */
  static Dfa runMode(String mode, String input, StateLimit stateLimit, boolean verify)
      throws IOException, FormatException, ValidationException {
    return switch (mode) {
      case "convert" -> convert(readNfa(input, stateLimit), verify);
      case "determinize" -> determinize(readNfa(input, stateLimit), verify);
      case "minimize" -> minimize(readDfa(input), verify);
      default -> throw new IllegalStateException("Unexpected mode choice: " + mode);
    };
  }

  /**
   * Validate, determinize and minimize.
   */
  public static Dfa convert(RawNfa raw, boolean verify) throws ValidationException {
    VerifiedNfa nfa = AutomatonValidator.validate(raw);
    System.out.println("Original NFA size: " + nfa.size());
    System.out.println("Alphabet size: " + nfa.getAlphabet().size());

    Dfa dfa = SubsetDeterminizer.determinize(nfa);
    System.out.println("Unminimized SC DFA size: " + dfa.size());
    Dfa minimal = TableFillingMinimizer.minimize(dfa);

    if (verify) {
      CompactNFA<String> compact = CompactConversions.toCompactNFA(nfa);
      Alphabet<String> alphabet = compact.getInputAlphabet();
      CompactDFA<String> reference = HopcroftMinimizer.minimizeDFA(NFAs.determinize(compact, alphabet), alphabet);
      System.out.println("AutomataLib minimized DFA size: " + reference.size());
      checkEquivalent(reference, minimal, alphabet);
    }
    return minimal;
  }

  /**
   * Validate and determinize only.
   */
  public static Dfa determinize(RawNfa raw, boolean verify) throws ValidationException {
    VerifiedNfa nfa = AutomatonValidator.validate(raw);
    System.out.println("Original NFA size: " + nfa.size());
    Dfa dfa = SubsetDeterminizer.determinize(nfa);

    if (verify) {
      CompactNFA<String> compact = CompactConversions.toCompactNFA(nfa);
      Alphabet<String> alphabet = compact.getInputAlphabet();
      checkEquivalent(NFAs.determinize(compact, alphabet, false, false), dfa, alphabet);
    }
    return dfa;
  }

  /**
   * Validate a DFA document and minimize it.
   */
  public static Dfa minimize(RawDfa raw, boolean verify) throws ValidationException {
    Dfa dfa = AutomatonValidator.validateDeterministic(raw);
    System.out.println("Original DFA size: " + dfa.size());
    Dfa minimal = TableFillingMinimizer.minimize(dfa);

    if (verify) {
      checkEquivalent(CompactConversions.toCompactDFA(dfa), minimal,
          Alphabets.fromCollection(dfa.getAlphabet()));
    }
    return minimal;
  }

  private static void checkEquivalent(CompactDFA<String> reference, Dfa result, Alphabet<String> alphabet) {
    if (!Automata.testEquivalence(reference, CompactConversions.toCompactDFA(result), alphabet)) {
      throw new IllegalStateException("Result is not equivalent to the AutomataLib reference");
    }
    System.out.println("Verified against AutomataLib");
  }

  private static RawNfa readNfa(String input, StateLimit stateLimit) throws IOException, FormatException {
    RawNfa raw;
    if (input.endsWith(".ba")) {
      raw = BAFormat.getBAFile(input);
    } else {
      try (InputStream is = new FileInputStream(input)) {
        raw = JsonFormat.readNfa(is);
      }
    }
    if (stateLimit.isAboveThreshold(raw.nodes().size())) {
      throw new IOException(raw.nodes().size() + " NFA states exceed the limit of " + stateLimit.getStateThreshold()
          + " (see --maxStates)");
    }
    return raw;
  }

  private static RawDfa readDfa(String input) throws IOException {
    try (InputStream is = new FileInputStream(input)) {
      return JsonFormat.readDfa(is);
    }
  }

  private static void serve(String port, StateLimit stateLimit) {
    try {
      ConversionServer server = new ConversionServer(Integer.parseInt(port), new ConversionService(stateLimit));
      server.start();
    } catch (NumberFormatException e) {
      System.err.println("Invalid port: " + port);
      System.exit(2);
    } catch (IOException e) {
      System.err.println("Could not start server: " + e.getMessage());
      System.exit(1);
    }
  }
}
