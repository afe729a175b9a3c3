package NFAMin.Model;

/**
 * Cap on the size of an incoming NFA. Subset construction is exponential in the number of NFA states in the
 * worst case, so requests above the cap are refused before any work is done.
 */
public class StateLimit {
    public static final int DEFAULT_MAX_STATES = 64;

    private final int stateThreshold;

    public StateLimit() {
        this(DEFAULT_MAX_STATES);
    }

    public StateLimit(int stateThreshold) {
        if (stateThreshold < 1) {
            throw new IllegalArgumentException("State limit must be positive: " + stateThreshold);
        }
        this.stateThreshold = stateThreshold;
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isAboveThreshold(int states) {
        return states > stateThreshold;
    }

    public static StateLimit unlimited() {
        return new StateLimit(Integer.MAX_VALUE);
    }

    @Override
    public String toString() {
        return stateThreshold == Integer.MAX_VALUE ? "unlimited" : String.valueOf(stateThreshold);
    }
}
