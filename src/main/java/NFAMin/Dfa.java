package NFAMin;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import NFAMin.Model.RawDfa;

/**
 * Immutable deterministic automaton; states are the keys of the transition table.
 * Transitions may be partial, a missing transition rejects.
 */
public final class Dfa {
    private final String start;
    private final SortedSet<String> alphabet;
    private final SortedSet<String> finalStates;
    private final SortedSet<String> states;
    private final SortedMap<String, SortedMap<String, String>> nodes;

    /**
     * @throws IllegalArgumentException if a referenced state or symbol is unknown
     */
    public Dfa(String start,
               Collection<String> alphabet,
               Collection<String> finalStates,
               Map<String, ? extends Map<String, String>> nodes) {
        this.start = Objects.requireNonNull(start, "start");
        this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
        this.finalStates = Collections.unmodifiableSortedSet(new TreeSet<>(finalStates));

        SortedMap<String, SortedMap<String, String>> table = new TreeMap<>();
        nodes.forEach((state, row) -> table.put(state, Collections.unmodifiableSortedMap(new TreeMap<>(row))));
        this.nodes = Collections.unmodifiableSortedMap(table);
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(table.keySet()));

        checkInvariants();
    }

    private void checkInvariants() {
        if (!nodes.containsKey(start)) {
            throw new IllegalArgumentException("Start state is not a DFA state: " + start);
        }
        for (String f : finalStates) {
            if (!nodes.containsKey(f)) {
                throw new IllegalArgumentException("Final state is not a DFA state: " + f);
            }
        }
        for (Map.Entry<String, SortedMap<String, String>> node : nodes.entrySet()) {
            for (Map.Entry<String, String> trans : node.getValue().entrySet()) {
                if (!alphabet.contains(trans.getKey())) {
                    throw new IllegalArgumentException("Symbol is not in the alphabet: " + trans.getKey());
                }
                if (!nodes.containsKey(trans.getValue())) {
                    throw new IllegalArgumentException(
                        "Transition " + node.getKey() + " -" + trans.getKey() + "-> " + trans.getValue()
                            + " leads to an unknown state");
                }
            }
        }
    }

    public String getStart() {
        return start;
    }

    public SortedSet<String> getAlphabet() {
        return alphabet;
    }

    public SortedSet<String> getFinalStates() {
        return finalStates;
    }

    public SortedSet<String> getStates() {
        return states;
    }

    public SortedMap<String, SortedMap<String, String>> getNodes() {
        return nodes;
    }

    /**
     * @return destination, or null if state has no transition on symbol
     */
    public String getTransition(String state, String symbol) {
        SortedMap<String, String> row = nodes.get(state);
        return row == null ? null : row.get(symbol);
    }

    public boolean isAccepting(String state) {
        return finalStates.contains(state);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return whether every state has a transition on every alphabet symbol
     */
    public boolean isComplete() {
        for (SortedMap<String, String> row : nodes.values()) {
            if (!row.keySet().containsAll(alphabet)) {
                return false;
            }
        }
        return true;
    }

    public boolean accepts(List<String> word) {
        String current = start;
        for (String sym : word) {
            current = getTransition(current, sym);
            if (current == null) {
                return false;
            }
        }
        return isAccepting(current);
    }

    public RawDfa toRaw() {
        return new RawDfa(start, alphabet, finalStates, new TreeMap<>(nodes));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dfa other)) {
            return false;
        }
        return start.equals(other.start) && alphabet.equals(other.alphabet)
            && finalStates.equals(other.finalStates) && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        int result = start.hashCode();
        result = 31 * result + alphabet.hashCode();
        result = 31 * result + finalStates.hashCode();
        result = 31 * result + nodes.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "DFA(start=" + start + ", final=" + finalStates + ", nodes=" + nodes + ")";
    }
}
