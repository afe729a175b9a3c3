package NFAMin.Registry;

import java.util.BitSet;

/**
 * Known subset-construction configurations and the DFA state each one became.
 */
public interface Registry {
    /**
     * Get the DFA state name of a configuration.
     * @param configuration set of NFA state indices
     * @return state name, or null if the configuration has not been seen yet
     */
    String get(BitSet configuration);

    /**
     * Register a new configuration under its display name.
     * @param configuration set of NFA state indices
     * @param name display name, must not be used by any other configuration
     * @throws IllegalStateException if the configuration is already registered or the name is taken
     */
    void put(BitSet configuration, String name);

    /**
     * @return number of registered configurations
     */
    int size();

    default boolean contains(BitSet configuration) {
        return get(configuration) != null;
    }
}
