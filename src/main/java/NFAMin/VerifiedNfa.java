package NFAMin;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import NFAMin.Model.RawNfa;

/**
 * An NFA that passed {@link AutomatonValidator#validate(RawNfa)}.
 * Instances can only be created by the validator, so every method here may rely on the structural invariants:
 * start, final states and all destinations are known states, and every transition symbol is in the alphabet.
 */
public final class VerifiedNfa {
    private final String start;
    private final SortedSet<String> alphabet;
    private final SortedSet<String> finalStates;
    private final SortedSet<String> states;
    private final SortedMap<String, SortedMap<String, SortedSet<String>>> nodes;

    VerifiedNfa(RawNfa raw) {
        this.start = raw.start();
        this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(raw.alphabet()));
        this.finalStates = Collections.unmodifiableSortedSet(new TreeSet<>(raw.finalStates()));

        SortedMap<String, SortedMap<String, SortedSet<String>>> table = new TreeMap<>();
        for (Map.Entry<String, Map<String, Set<String>>> node : raw.nodes().entrySet()) {
            SortedMap<String, SortedSet<String>> row = new TreeMap<>();
            if (node.getValue() != null) {
                for (Map.Entry<String, Set<String>> trans : node.getValue().entrySet()) {
                    if (trans.getValue() != null && !trans.getValue().isEmpty()) {
                        row.put(trans.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(trans.getValue())));
                    }
                }
            }
            table.put(node.getKey(), Collections.unmodifiableSortedMap(row));
        }
        this.nodes = Collections.unmodifiableSortedMap(table);
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(table.keySet()));
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

    /**
     * @return all states, in sorted order
     */
    public SortedSet<String> getStates() {
        return states;
    }

    public SortedMap<String, SortedMap<String, SortedSet<String>>> getNodes() {
        return nodes;
    }

    /**
     * Destinations of state on symbol; empty if there are none.
     */
    public Set<String> getTransitions(String state, String symbol) {
        SortedMap<String, SortedSet<String>> row = nodes.get(state);
        if (row == null) {
            return Collections.emptySet();
        }
        SortedSet<String> dests = row.get(symbol);
        return dests == null ? Collections.emptySet() : dests;
    }

    public boolean isAccepting(String state) {
        return finalStates.contains(state);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Acceptance by simulating the set of active states.
     * @param word - sequence of symbols
     * @return whether some run on word ends in a final state
     */
    public boolean accepts(List<String> word) {
        Set<String> current = Set.of(start);
        for (String sym : word) {
            Set<String> next = new HashSet<>();
            for (String state : current) {
                next.addAll(getTransitions(state, sym));
            }
            if (next.isEmpty()) {
                return false;
            }
            current = next;
        }
        for (String state : current) {
            if (isAccepting(state)) {
                return true;
            }
        }
        return false;
    }

    public RawNfa toRaw() {
        Map<String, Map<String, Set<String>>> raw = new TreeMap<>();
        nodes.forEach((state, row) -> raw.put(state, new TreeMap<>(row)));
        return new RawNfa(start, alphabet, finalStates, raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VerifiedNfa other)) {
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
        return "NFA(start=" + start + ", final=" + finalStates + ", nodes=" + nodes + ")";
    }
}
