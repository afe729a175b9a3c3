package NFAMin;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import NFAMin.Model.RawDfa;
import NFAMin.Model.RawNfa;

/**
 * Structural checks on untrusted automata. Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>the start state is a known state</li>
 *   <li>every final state is a known state</li>
 *   <li>the alphabet has no null symbol, and every transition symbol is in the alphabet</li>
 *   <li>every transition destination is a known state</li>
 * </ol>
 * Within a check, states and symbols are visited in sorted order, so the reported problem is reproducible.
 */
public class AutomatonValidator {
    private AutomatonValidator() {
    }

    /**
     * Validate an NFA.
     * @param raw - NFA as read from the wire
     * @return structurally identical NFA, usable by {@link SubsetDeterminizer}
     * @throws UnknownStateException if the start state, a final state or a destination is not a known state
     * @throws UnknownSymbolException if the alphabet holds a null symbol, or a transition uses a symbol outside
     *     the alphabet
     */
    public static VerifiedNfa validate(RawNfa raw) throws ValidationException {
        final Set<String> states = raw.nodes().keySet();
        final Map<String, Map<String, Set<String>>> nodes = new TreeMap<>(raw.nodes());

        checkStart(raw.start(), states);
        checkFinalStates(raw.finalStates(), states);

        Set<String> alphabet = raw.alphabet();
        checkAlphabet(alphabet);
        for (Map<String, Set<String>> row : nodes.values()) {
            if (row != null) {
                checkSymbols(row.keySet(), alphabet);
            }
        }

        for (Map<String, Set<String>> row : nodes.values()) {
            if (row == null) {
                continue;
            }
            for (Set<String> dests : new TreeMap<>(row).values()) {
                if (dests != null) {
                    checkDestinations(dests, states);
                }
            }
        }

        return new VerifiedNfa(raw);
    }

    /**
     * Validate a DFA given directly on the wire. Same checks, same order as {@link #validate(RawNfa)}.
     * @param raw - DFA as read from the wire
     * @return DFA, usable by {@link TableFillingMinimizer}
     */
    public static Dfa validateDeterministic(RawDfa raw) throws ValidationException {
        final Set<String> states = raw.nodes().keySet();
        final Map<String, Map<String, String>> nodes = new TreeMap<>();
        raw.nodes().forEach((state, row) -> nodes.put(state, row == null ? Map.of() : row));

        checkStart(raw.start(), states);
        checkFinalStates(raw.finalStates(), states);

        checkAlphabet(raw.alphabet());
        for (Map<String, String> row : nodes.values()) {
            checkSymbols(row.keySet(), raw.alphabet());
        }

        for (Map<String, String> row : nodes.values()) {
            for (String dest : new TreeMap<>(row).values()) {
                if (dest == null || !states.contains(dest)) {
                    throw new UnknownStateException(dest);
                }
            }
        }

        return new Dfa(raw.start(), raw.alphabet(), raw.finalStates(), nodes);
    }

    private static void checkStart(String start, Set<String> states) throws UnknownStateException {
        if (!states.contains(start)) {
            throw new UnknownStateException(start);
        }
    }

    private static void checkFinalStates(Collection<String> finalStates, Set<String> states)
        throws UnknownStateException {
        for (String f : sorted(finalStates)) {
            if (!states.contains(f)) {
                throw new UnknownStateException(f);
            }
        }
    }

    private static void checkAlphabet(Collection<String> alphabet) throws UnknownSymbolException {
        for (String sym : alphabet) {
            if (sym == null) {
                throw new UnknownSymbolException(null);
            }
        }
    }

    private static void checkSymbols(Collection<String> used, Set<String> alphabet) throws UnknownSymbolException {
        for (String sym : new TreeSet<>(used)) {
            if (!alphabet.contains(sym)) {
                throw new UnknownSymbolException(sym);
            }
        }
    }

    private static void checkDestinations(Collection<String> dests, Set<String> states)
        throws UnknownStateException {
        for (String dest : sorted(dests)) {
            if (!states.contains(dest)) {
                throw new UnknownStateException(dest);
            }
        }
    }

    private static TreeSet<String> sorted(Collection<String> ids) throws UnknownStateException {
        TreeSet<String> result = new TreeSet<>();
        for (String id : ids) {
            if (id == null) {
                throw new UnknownStateException(null);
            }
            result.add(id);
        }
        return result;
    }
}
