package NFAMin;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import NFAMin.Model.RawNfa;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;

/**
 * Reads automata in the BA format (https://languageinclusion.org/doku.php?id=tools).
 */
public class BAFormat {
    /*
    We just use code from Automatalib and convert from a CompactNFA<String>
     */
    public static RawNfa convertBAToRawNfa(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        final Alphabet<String> alphabet = automaton.getInputAlphabet();
        final Set<Integer> initialStates = automaton.getInitialStates();
        if (initialStates.size() != 1) {
            throw new FormatException("Expected exactly one initial state, found " + initialStates.size());
        }

        Map<String, Map<String, Set<String>>> nodes = new HashMap<>();
        Set<String> finalStates = new HashSet<>();
        for (int state : automaton.getStates()) {
            Map<String, Set<String>> row = new HashMap<>();
            for (String sym : alphabet) {
                Collection<Integer> dests = automaton.getTransitions(state, sym);
                if (!dests.isEmpty()) {
                    Set<String> destIds = new HashSet<>();
                    for (int dest : dests) {
                        destIds.add(String.valueOf(dest));
                    }
                    row.put(sym, destIds);
                }
            }
            nodes.put(String.valueOf(state), row);
            if (automaton.isAccepting(state)) {
                finalStates.add(String.valueOf(state));
            }
        }

        String start = String.valueOf(initialStates.iterator().next());
        return new RawNfa(start, new HashSet<>(alphabet), finalStates, nodes);
    }

    static RawNfa getBAFile(String filePath) throws IOException, FormatException {
        try (InputStream is = new FileInputStream(filePath)) {
            return convertBAToRawNfa(is);
        }
    }
}
