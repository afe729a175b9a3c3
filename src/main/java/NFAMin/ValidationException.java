package NFAMin;

/**
 * An automaton description that is not well-formed. Validation stops at the first problem found.
 */
public abstract class ValidationException extends Exception {
    private final String identifier;

    protected ValidationException(String message, String identifier) {
        super(message);
        this.identifier = identifier;
    }

    /**
     * @return the offending state id or symbol
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * @return short error kind, as reported to clients
     */
    public abstract String getKind();
}
