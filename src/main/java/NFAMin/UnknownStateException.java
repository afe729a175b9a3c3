package NFAMin;

/**
 * A start state, final state or transition destination that is not a key of the transition table.
 */
public class UnknownStateException extends ValidationException {
    public UnknownStateException(String state) {
        super("Unknown state: " + state, state);
    }

    @Override
    public String getKind() {
        return "UnknownState";
    }
}
