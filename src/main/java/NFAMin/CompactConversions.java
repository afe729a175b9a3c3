package NFAMin;

import java.util.HashMap;
import java.util.Map;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Copies of our automata as AutomataLib compact automata, for cross-checking against its algorithms.
 */
public class CompactConversions {
    private CompactConversions() {
    }

    public static CompactNFA<String> toCompactNFA(VerifiedNfa nfa) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(nfa.getAlphabet());
        final CompactNFA<String> out = new CompactNFA<>(alphabet, nfa.size());
        final Map<String, Integer> ids = new HashMap<>();
        for (String state : nfa.getStates()) {
            ids.put(state, out.addState(nfa.isAccepting(state)));
        }
        out.setInitial(ids.get(nfa.getStart()), true);
        for (String state : nfa.getStates()) {
            for (String sym : alphabet) {
                for (String dest : nfa.getTransitions(state, sym)) {
                    out.addTransition(ids.get(state), sym, ids.get(dest));
                }
            }
        }
        return out;
    }

    public static CompactDFA<String> toCompactDFA(Dfa dfa) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(dfa.getAlphabet());
        final CompactDFA<String> out = new CompactDFA<>(alphabet, dfa.size());
        final Map<String, Integer> ids = new HashMap<>();
        for (String state : dfa.getStates()) {
            ids.put(state, out.addState(dfa.isAccepting(state)));
        }
        out.setInitial(ids.get(dfa.getStart()), true);
        for (String state : dfa.getStates()) {
            for (String sym : alphabet) {
                String dest = dfa.getTransition(state, sym);
                if (dest != null) {
                    out.setTransition(ids.get(state), sym, ids.get(dest));
                }
            }
        }
        return out;
    }
}
