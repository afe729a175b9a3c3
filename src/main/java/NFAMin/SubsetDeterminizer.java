package NFAMin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import NFAMin.Model.DeterminizeRecord;
import NFAMin.Registry.AddressRegistry;
import NFAMin.Registry.Registry;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Subset construction. Each DFA state is a configuration (set of NFA states), keyed structurally by a
 * {@link BitSet} over the sorted NFA state order and named by {@link StateNames#ofConfiguration}.
 */
public class SubsetDeterminizer {
    public static boolean DEBUG = false;

    private SubsetDeterminizer() {
    }

    public static Dfa determinize(VerifiedNfa nfa) {
        return determinize(nfa, new AddressRegistry());
    }

    /**
     * Determinize a verified NFA. The result is total: the empty configuration, if reachable, becomes the
     * non-accepting state "" looping on every symbol.
     * @param nfa - verified NFA
     * @param registry - empty registry for configurations
     * @return DFA whose start state is the singleton configuration of the NFA start state
     */
    public static Dfa determinize(VerifiedNfa nfa, Registry registry) {
        final List<String> stateOrder = new ArrayList<>(nfa.getStates());
        final Object2IntMap<String> stateIndex = new Object2IntOpenHashMap<>(stateOrder.size());
        for (int i = 0; i < stateOrder.size(); i++) {
            stateIndex.put(stateOrder.get(i), i);
        }
        final List<String> alphabet = new ArrayList<>(nfa.getAlphabet());

        // successors[state][symbol], precomputed once
        final BitSet[][] successors = new BitSet[stateOrder.size()][alphabet.size()];
        final BitSet accepting = new BitSet(stateOrder.size());
        for (int s = 0; s < stateOrder.size(); s++) {
            String state = stateOrder.get(s);
            if (nfa.isAccepting(state)) {
                accepting.set(s);
            }
            for (int a = 0; a < alphabet.size(); a++) {
                BitSet succ = new BitSet(stateOrder.size());
                for (String dest : nfa.getTransitions(state, alphabet.get(a))) {
                    succ.set(stateIndex.getInt(dest));
                }
                successors[s][a] = succ;
            }
        }

        final Map<String, Map<String, String>> nodes = new LinkedHashMap<>();
        final Set<String> finalStates = new TreeSet<>();
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        BitSet init = new BitSet(stateOrder.size());
        init.set(stateIndex.getInt(nfa.getStart()));
        String initName = nameOf(init, stateOrder);
        registry.put(init, initName);
        queue.add(new DeterminizeRecord(init, initName));

        while (!queue.isEmpty()) {
            DeterminizeRecord curr = queue.poll();
            BitSet inState = curr.configuration();
            if (nodes.containsKey(curr.name())) {
                // configurations are registered when queued, so each one is resolved exactly once
                throw new IllegalStateException("Configuration resolved twice: " + curr);
            }

            Map<String, String> row = new LinkedHashMap<>();
            for (int a = 0; a < alphabet.size(); a++) {
                BitSet succ = new BitSet(stateOrder.size());
                for (int s = inState.nextSetBit(0); s >= 0; s = inState.nextSetBit(s + 1)) {
                    succ.or(successors[s][a]);
                }
                String succName = registry.get(succ);
                if (succName == null) {
                    // add new state to DFA and to queue
                    succName = nameOf(succ, stateOrder);
                    registry.put(succ, succName);
                    queue.add(new DeterminizeRecord(succ, succName));
                }
                row.put(alphabet.get(a), succName);
            }

            if (inState.intersects(accepting)) {
                finalStates.add(curr.name());
            }
            nodes.put(curr.name(), row);
        }

        if (DEBUG) {
            System.out.println("DEBUG: Subset construction: " + nfa.size() + " NFA states -> "
                + nodes.size() + " DFA states");
        }

        return new Dfa(initName, alphabet, finalStates, nodes);
    }

    private static String nameOf(BitSet configuration, List<String> stateOrder) {
        List<String> members = new ArrayList<>(configuration.cardinality());
        for (int s = configuration.nextSetBit(0); s >= 0; s = configuration.nextSetBit(s + 1)) {
            members.add(stateOrder.get(s));
        }
        return StateNames.ofConfiguration(members);
    }
}
