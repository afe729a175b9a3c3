package NFAMin.Model;

import java.util.BitSet;

/**
 * Worklist entry of subset construction: a configuration of NFA state indices and its DFA state name.
 */
public record DeterminizeRecord(BitSet configuration, String name) {

  @Override
  public String toString() {
    return "\"" + name + "\": " + configuration;
  }
}
