package NFAMin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * DFA minimization by table filling (Myhill-Nerode), followed by merging of equivalent states.
 * States are indexed in sorted name order, so a pair (p, q) with p &lt; q has the lexicographically smaller
 * name first.
 */
public class TableFillingMinimizer {
    public static boolean DEBUG = false;

    private static final int NO_STATE = -1;

    private TableFillingMinimizer() {
    }

    /**
     * Minimize a DFA. Unreachable states are dropped, then every group of equivalent states is collapsed into
     * one state named by {@link StateNames#ofEquivalenceClass}. The input is not modified.
     * @param dfa - DFA, possibly partial
     * @return equivalent DFA with the fewest states; missing transitions of the input stay missing
     */
    public static Dfa minimize(Dfa dfa) {
        final List<String> names = new ArrayList<>(reachableStates(dfa));
        final int n = names.size();
        final Object2IntMap<String> index = new Object2IntOpenHashMap<>(n);
        index.defaultReturnValue(NO_STATE);
        for (int i = 0; i < n; i++) {
            index.put(names.get(i), i);
        }
        final List<String> alphabet = new ArrayList<>(dfa.getAlphabet());
        final int k = alphabet.size();

        // transition table; an artificial sink (index n) completes a partial DFA
        int[][] delta = new int[n + 1][k];
        boolean partial = false;
        for (int i = 0; i < n; i++) {
            for (int a = 0; a < k; a++) {
                String dest = dfa.getTransition(names.get(i), alphabet.get(a));
                delta[i][a] = dest == null ? n : index.getInt(dest);
                partial |= dest == null;
            }
        }
        final int size = partial ? n + 1 : n;
        if (partial) {
            for (int a = 0; a < k; a++) {
                delta[n][a] = n;
            }
        }
        final boolean[] accepting = new boolean[size];
        for (int i = 0; i < n; i++) {
            accepting[i] = dfa.isAccepting(names.get(i));
        }

        final boolean[][] distinguishable = findDistinguishable(delta, accepting, size, k);
        final int[] representative = mergeEquivalent(distinguishable, names, n);
        return rebuild(dfa, names, alphabet, delta, accepting, representative, index);
    }

    /**
     * Forward reachability from the start state.
     */
    static Set<String> reachableStates(Dfa dfa) {
        Set<String> seen = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(dfa.getStart());
        queue.add(dfa.getStart());
        while (!queue.isEmpty()) {
            String state = queue.poll();
            for (String succ : dfa.getNodes().get(state).values()) {
                if (seen.add(succ)) {
                    queue.add(succ);
                }
            }
        }
        return seen;
    }

    /**
     * Table filling with a worklist. A pair is distinguishable at round zero if exactly one side accepts;
     * distinguishability then propagates backwards along the reverse transition graph until a fixpoint.
     * @return distinguishable[p][q] for p &lt; q; every unmarked pair is equivalent
     */
    static boolean[][] findDistinguishable(int[][] delta, boolean[] accepting, int size, int k) {
        // reverse graph: preds[a][q] are the states reaching q on symbol a
        IntList[][] preds = new IntList[k][size];
        for (int a = 0; a < k; a++) {
            for (int q = 0; q < size; q++) {
                preds[a][q] = new IntArrayList();
            }
            for (int p = 0; p < size; p++) {
                preds[a][delta[p][a]].add(p);
            }
        }

        boolean[][] distinguishable = new boolean[size][size];
        Deque<IntIntPair> worklist = new ArrayDeque<>();
        for (int p = 0; p < size; p++) {
            for (int q = p + 1; q < size; q++) {
                if (accepting[p] != accepting[q]) {
                    distinguishable[p][q] = true;
                    worklist.add(new IntIntImmutablePair(p, q));
                }
            }
        }

        while (!worklist.isEmpty()) {
            IntIntPair pair = worklist.poll();
            for (int a = 0; a < k; a++) {
                IntList predsLeft = preds[a][pair.leftInt()];
                IntList predsRight = preds[a][pair.rightInt()];
                if (predsLeft.isEmpty() || predsRight.isEmpty()) {
                    continue;
                }
                for (int i = 0; i < predsLeft.size(); i++) {
                    int p = predsLeft.getInt(i);
                    for (int j = 0; j < predsRight.size(); j++) {
                        int q = predsRight.getInt(j);
                        if (p == q) {
                            continue;
                        }
                        int lo = Math.min(p, q);
                        int hi = Math.max(p, q);
                        if (!distinguishable[lo][hi]) {
                            distinguishable[lo][hi] = true;
                            worklist.add(new IntIntImmutablePair(lo, hi));
                        }
                    }
                }
            }
        }
        return distinguishable;
    }

    /**
     * Walk the equivalent pairs in order and fold the right state into the left one, skipping pairs where
     * either side was already merged away. The sink never takes part.
     * @return representative[i] for every real state i
     */
    private static int[] mergeEquivalent(boolean[][] distinguishable, List<String> names, int n) {
        int[] representative = new int[n];
        for (int i = 0; i < n; i++) {
            representative[i] = i;
        }
        for (int left = 0; left < n; left++) {
            for (int right = left + 1; right < n; right++) {
                if (distinguishable[left][right]) {
                    continue;
                }
                if (representative[left] != left || representative[right] != right) {
                    continue;
                }
                representative[right] = left;
                if (DEBUG) {
                    System.out.println("DEBUG: Merging \"" + names.get(right) + "\" into \"" + names.get(left) + "\"");
                }
            }
        }
        return representative;
    }

    private static Dfa rebuild(Dfa dfa, List<String> names, List<String> alphabet, int[][] delta,
                               boolean[] accepting, int[] representative, Object2IntMap<String> index) {
        final int n = names.size();
        Map<Integer, List<String>> classes = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            classes.computeIfAbsent(representative[i], r -> new ArrayList<>()).add(names.get(i));
        }
        String[] className = new String[n];
        for (Map.Entry<Integer, List<String>> cls : classes.entrySet()) {
            className[cls.getKey()] = StateNames.ofEquivalenceClass(cls.getValue());
        }

        Map<String, SortedMap<String, String>> nodes = new LinkedHashMap<>();
        List<String> finalStates = new ArrayList<>();
        for (int rep : classes.keySet()) {
            SortedMap<String, String> row = new TreeMap<>();
            for (int a = 0; a < alphabet.size(); a++) {
                int dest = delta[rep][a];
                if (dest < n) {
                    row.put(alphabet.get(a), className[representative[dest]]);
                }
            }
            if (nodes.put(className[rep], row) != null) {
                throw new IllegalStateException("Two equivalence classes share the name " + className[rep]);
            }
            if (accepting[rep]) {
                finalStates.add(className[rep]);
            }
        }

        String start = className[representative[index.getInt(dfa.getStart())]];
        if (DEBUG) {
            System.out.println("DEBUG: Minimization: " + dfa.size() + " DFA states -> " + nodes.size() + " states");
        }
        return new Dfa(start, alphabet, finalStates, nodes);
    }
}
